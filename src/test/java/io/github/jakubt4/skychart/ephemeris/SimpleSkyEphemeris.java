package io.github.jakubt4.skychart.ephemeris;

import java.time.Instant;
import java.util.Map;

/**
 * Deterministic ephemeris for tests: the Sun from the low-precision almanac
 * formulae, other bodies pinned to fixed equatorial coordinates, and the
 * equatorial to horizontal rotation done by hand. Good to a fraction of a degree.
 */
public class SimpleSkyEphemeris implements Ephemeris, EphemerisSource {

    private static final double J2000 = 2451545.0;
    private static final double UNIX_EPOCH_JD = 2440587.5;

    // right ascension (degrees), declination (degrees)
    private static final Map<String, double[]> PINNED = Map.of(
            "moon", new double[]{120.0, 18.0},
            "mercury", new double[]{70.0, 22.0},
            "venus", new double[]{100.0, 23.0},
            "mars", new double[]{30.0, 12.0},
            "jupiter barycenter", new double[]{55.0, 20.0},
            "saturn barycenter", new double[]{345.0, -7.0},
            "uranus barycenter", new double[]{52.0, 19.0},
            "neptune barycenter", new double[]{359.0, -2.0}
    );

    @Override
    public Ephemeris load() {
        return this;
    }

    @Override
    public Observatory observatory(final double latitudeDegrees, final double longitudeDegrees) {
        return (target, instant) -> observe(target, instant, latitudeDegrees, longitudeDegrees);
    }

    static AltAz observe(final CelestialTarget target, final Instant instant,
                         final double latitudeDegrees, final double longitudeDegrees) {
        final double[] raDec;
        if (target instanceof FixedStar star) {
            raDec = new double[]{star.raHours() * 15.0, star.decDegrees()};
        } else {
            final var name = ((EphemerisBody) target).name();
            if ("sun".equals(name)) {
                raDec = sunRaDec(instant);
            } else if (PINNED.containsKey(name)) {
                raDec = PINNED.get(name);
            } else {
                throw new IllegalArgumentException("Body not in ephemeris: " + name);
            }
        }
        if (Math.abs(raDec[1]) > 90.0) {
            throw new IllegalArgumentException("Declination out of range: " + raDec[1]);
        }

        final var days = julianDate(instant) - J2000;
        final var gmst = 280.46061837 + 360.98564736629 * days;
        final var hourAngle = Math.toRadians(gmst + longitudeDegrees - raDec[0]);
        final var dec = Math.toRadians(raDec[1]);
        final var lat = Math.toRadians(latitudeDegrees);

        final var altitude = Math.asin(Math.sin(lat) * Math.sin(dec)
                + Math.cos(lat) * Math.cos(dec) * Math.cos(hourAngle));
        var azimuth = Math.atan2(-Math.cos(dec) * Math.sin(hourAngle),
                Math.sin(dec) * Math.cos(lat) - Math.cos(dec) * Math.cos(hourAngle) * Math.sin(lat));
        if (azimuth < 0.0) {
            azimuth += 2.0 * Math.PI;
        }
        return new AltAz(Math.toDegrees(altitude), azimuth);
    }

    static double[] sunRaDec(final Instant instant) {
        final var n = julianDate(instant) - J2000;
        final var meanLongitude = 280.460 + 0.9856474 * n;
        final var meanAnomaly = Math.toRadians(357.528 + 0.9856003 * n);
        final var eclipticLongitude = Math.toRadians(meanLongitude
                + 1.915 * Math.sin(meanAnomaly) + 0.020 * Math.sin(2.0 * meanAnomaly));
        final var obliquity = Math.toRadians(23.439 - 0.0000004 * n);

        final var ra = Math.toDegrees(Math.atan2(
                Math.cos(obliquity) * Math.sin(eclipticLongitude), Math.cos(eclipticLongitude)));
        final var dec = Math.toDegrees(Math.asin(Math.sin(obliquity) * Math.sin(eclipticLongitude)));
        return new double[]{ra, dec};
    }

    private static double julianDate(final Instant instant) {
        return instant.getEpochSecond() / 86400.0 + UNIX_EPOCH_JD;
    }
}
