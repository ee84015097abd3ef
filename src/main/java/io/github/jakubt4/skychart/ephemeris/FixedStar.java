package io.github.jakubt4.skychart.ephemeris;

/**
 * A point on the celestial sphere that does not move with time (J2000 / ICRS).
 *
 * @param raHours    right ascension in hours, nominally {@code [0, 24)}
 * @param decDegrees declination in degrees
 */
public record FixedStar(double raHours, double decDegrees) implements CelestialTarget {

    public static FixedStar ofDegrees(final double raDegrees, final double decDegrees) {
        return new FixedStar(raDegrees / 15.0, decDegrees);
    }
}
