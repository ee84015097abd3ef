package io.github.jakubt4.skychart.sky;

import io.github.jakubt4.skychart.ephemeris.CelestialTarget;
import io.github.jakubt4.skychart.scene.Polyline;
import io.github.jakubt4.skychart.scene.ScenePath;
import io.github.jakubt4.skychart.theme.Theme;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * A body's track across one local calendar day, sampled every
 * {@link #CADENCE} from local midnight. Immutable once built by {@link PathSampler}.
 */
public final class BodyPath {

    public static final Duration CADENCE = Duration.ofMinutes(20);
    public static final int SAMPLES_PER_HOUR = 3;
    public static final int SAMPLE_COUNT = 24 * SAMPLES_PER_HOUR + 1;

    private final String name;
    private final CelestialTarget body;
    private final LocalDate day;
    private final List<Instant> sampleTimes;
    private final Polyline samples;
    private final PathStyle style;

    BodyPath(final String name, final CelestialTarget body, final LocalDate day,
             final List<Instant> sampleTimes, final Polyline samples, final PathStyle style) {
        this.name = name;
        this.body = body;
        this.day = day;
        this.sampleTimes = List.copyOf(sampleTimes);
        this.samples = samples;
        this.style = style;
    }

    public String name() {
        return name;
    }

    public CelestialTarget body() {
        return body;
    }

    public LocalDate day() {
        return day;
    }

    public List<Instant> sampleTimes() {
        return sampleTimes;
    }

    public Polyline samples() {
        return samples;
    }

    public PathStyle style() {
        return style;
    }

    public ScenePath toScenePath(final Theme theme) {
        return new ScenePath(name, samples, theme.color(style.colorKey()),
                style.dashed(), style.lineWidth(), style.alpha());
    }
}
