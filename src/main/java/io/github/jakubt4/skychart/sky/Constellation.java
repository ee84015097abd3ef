package io.github.jakubt4.skychart.sky;

import io.github.jakubt4.skychart.scene.ConstellationStyle;
import io.github.jakubt4.skychart.scene.HorizontalCoordinate;
import io.github.jakubt4.skychart.scene.Polyline;
import io.github.jakubt4.skychart.scene.SceneConstellation;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * A named constellation figure in equatorial coordinates. Projected to the
 * horizontal frame for every frame, since the equatorial figure is fixed but its
 * place in the observer's sky is not.
 */
public record Constellation(String name, List<ConstellationSegment> segments) {

    static final int LINE_VERTICES = 10;

    public Constellation {
        segments = List.copyOf(segments);
    }

    /**
     * Projects every segment that has at least one end above the horizon. Star
     * markers are emitted once per distinct coordinate.
     */
    public SceneConstellation project(final CoordinateEngine engine, final ObserverLocation observer,
                                      final Instant instant, final ConstellationStyle style) {
        final var stars = new LinkedHashSet<HorizontalCoordinate>();
        final var lines = new ArrayList<Polyline>();

        for (final var segment : segments) {
            final var first = engine.position(segment.start(), observer, instant);
            final var second = engine.position(segment.end(), observer, instant);
            if (first.belowHorizon() && second.belowHorizon()) {
                continue;
            }
            stars.add(first);
            stars.add(second);
            lines.add(connect(first, second));
        }
        return new SceneConstellation(name, new ArrayList<>(stars), lines, style);
    }

    /**
     * Straight line in (azimuth, zenith) space between two stars. When the azimuths
     * are more than π apart the smaller one is moved past 2π, so the line takes the
     * short way across north instead of sweeping around the chart.
     */
    static Polyline connect(final HorizontalCoordinate first, final HorizontalCoordinate second) {
        var azimuth1 = first.azimuth();
        var azimuth2 = second.azimuth();
        if (azimuth2 - azimuth1 > Math.PI) {
            azimuth1 += CoordinateEngine.TWO_PI;
        } else if (azimuth1 - azimuth2 > Math.PI) {
            azimuth2 += CoordinateEngine.TWO_PI;
        }
        return Polyline.linear(azimuth1, first.zenithAngle(), azimuth2, second.zenithAngle(), LINE_VERTICES);
    }
}
