package io.github.jakubt4.skychart.sky;

import io.github.jakubt4.skychart.ephemeris.CelestialTarget;
import io.github.jakubt4.skychart.scene.HorizontalCoordinate;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;

/**
 * Converts a target seen by an observer at an instant into chart coordinates:
 * azimuth in radians and altitude expressed as zenith angle in degrees.
 * Stateless; every call goes to the observer's ephemeris.
 */
public class CoordinateEngine {

    static final double TWO_PI = 2.0 * Math.PI;

    /**
     * @throws LocalizationException if {@code when} is not a single valid instant in the observer's zone
     */
    public HorizontalCoordinate position(final CelestialTarget target, final ObserverLocation observer,
                                         final LocalDateTime when) {
        return position(target, observer, localize(when, observer.zone()));
    }

    public HorizontalCoordinate position(final CelestialTarget target, final ObserverLocation observer,
                                         final Instant instant) {
        final var altAz = observer.observatory().observe(target, instant);
        return new HorizontalCoordinate(
                normalizeAzimuth(altAz.azimuthRadians()),
                HorizontalCoordinate.HORIZON - altAz.altitudeDegrees());
    }

    /**
     * Interprets a naive local date-time in {@code zone}, refusing DST gaps and folds.
     *
     * @throws LocalizationException if {@code when} does not name exactly one instant
     */
    public static Instant localize(final LocalDateTime when, final ZoneId zone) {
        final var offsets = zone.getRules().getValidOffsets(when);
        if (offsets.size() != 1) {
            throw new LocalizationException(when, zone, offsets.isEmpty());
        }
        return when.toInstant(offsets.get(0));
    }

    static double normalizeAzimuth(final double azimuth) {
        var normalized = azimuth % TWO_PI;
        if (normalized < 0.0) {
            normalized += TWO_PI;
        }
        return normalized >= TWO_PI ? 0.0 : normalized;
    }
}
