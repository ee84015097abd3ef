package io.github.jakubt4.skychart.sky;

import io.github.jakubt4.skychart.ephemeris.CelestialTarget;
import io.github.jakubt4.skychart.scene.Polyline;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;

/**
 * Samples a body's position over one local day into a {@link BodyPath}.
 *
 * <p>Samples step in absolute time from the start of the local day, so a day with
 * a DST transition still gets {@value BodyPath#SAMPLE_COUNT} samples, none of them
 * falling into a gap.
 */
public class PathSampler {

    private final CoordinateEngine engine;

    public PathSampler(final CoordinateEngine engine) {
        this.engine = engine;
    }

    public BodyPath build(final String name, final CelestialTarget body, final LocalDate day,
                          final ObserverLocation observer, final PathStyle style) {
        final var start = day.atStartOfDay(observer.zone()).toInstant();
        final var times = new ArrayList<Instant>(BodyPath.SAMPLE_COUNT);
        final var azimuths = new double[BodyPath.SAMPLE_COUNT];
        final var zeniths = new double[BodyPath.SAMPLE_COUNT];

        for (var i = 0; i < BodyPath.SAMPLE_COUNT; i++) {
            final var when = start.plus(BodyPath.CADENCE.multipliedBy(i));
            final var position = engine.position(body, observer, when);
            times.add(when);
            azimuths[i] = position.azimuth();
            zeniths[i] = position.zenithAngle();
        }
        return new BodyPath(name, body, day, times, new Polyline(azimuths, zeniths), style);
    }
}
