package io.github.jakubt4.skychart.sky;

import io.github.jakubt4.skychart.ephemeris.CelestialTarget;
import io.github.jakubt4.skychart.scene.ScenePoint;
import io.github.jakubt4.skychart.theme.Theme;

import java.time.Instant;

/**
 * A body plotted as a marker. Holds no position: it is projected afresh for every frame.
 */
public record SkyPoint(String label, CelestialTarget body, double size) {

    private static final String RINGED = "Saturn";

    public ScenePoint project(final CoordinateEngine engine, final ObserverLocation observer,
                              final Instant instant, final Theme theme) {
        return new ScenePoint(label,
                engine.position(body, observer, instant),
                theme.planetColor(label),
                size,
                theme.glow(),
                RINGED.equals(label));
    }
}
