package io.github.jakubt4.skychart.scene;

import java.util.Arrays;

/**
 * Ordered vertices in (azimuth, zenith angle) space, stored as two parallel
 * arrays ready for a polar line plot. Arrays are copied in and out.
 */
public record Polyline(double[] azimuths, double[] zenithAngles) {

    public Polyline {
        if (azimuths.length != zenithAngles.length) {
            throw new IllegalArgumentException("azimuths and zenith angles differ in length: "
                    + azimuths.length + " != " + zenithAngles.length);
        }
        azimuths = azimuths.clone();
        zenithAngles = zenithAngles.clone();
    }

    /**
     * {@code points} evenly spaced vertices from {@code start} to {@code end}, both included.
     */
    public static Polyline linear(final double startAzimuth, final double startZenith,
                                  final double endAzimuth, final double endZenith, final int points) {
        final var azimuths = new double[points];
        final var zeniths = new double[points];
        for (var i = 0; i < points; i++) {
            final var fraction = points == 1 ? 0.0 : (double) i / (points - 1);
            azimuths[i] = startAzimuth + (endAzimuth - startAzimuth) * fraction;
            zeniths[i] = startZenith + (endZenith - startZenith) * fraction;
        }
        return new Polyline(azimuths, zeniths);
    }

    @Override
    public double[] azimuths() {
        return azimuths.clone();
    }

    @Override
    public double[] zenithAngles() {
        return zenithAngles.clone();
    }

    public int size() {
        return azimuths.length;
    }

    @Override
    public boolean equals(final Object o) {
        return o instanceof Polyline other
                && Arrays.equals(azimuths, other.azimuths)
                && Arrays.equals(zenithAngles, other.zenithAngles);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(azimuths) + Arrays.hashCode(zenithAngles);
    }

    @Override
    public String toString() {
        return "Polyline[" + azimuths.length + " vertices]";
    }
}
