package io.github.jakubt4.skychart.sky;

import io.github.jakubt4.skychart.ephemeris.EphemerisBody;

import java.util.Arrays;
import java.util.Optional;

/**
 * Bodies the chart can plot, in drawing order, with their ephemeris names and
 * marker sizes (area in square points).
 */
public enum SolarSystemObject {

    SUN("Sun", "sun", 500),
    MERCURY("Mercury", "mercury", 40),
    VENUS("Venus", "venus", 60),
    MOON("Moon", "moon", 300),
    MARS("Mars", "mars", 60),
    JUPITER("Jupiter", "jupiter barycenter", 100),
    SATURN("Saturn", "saturn barycenter", 90),
    URANUS("Uranus", "uranus barycenter", 40),
    NEPTUNE("Neptune", "neptune barycenter", 30);

    public static final double DEFAULT_MARKER_SIZE = 50;

    private final String label;
    private final EphemerisBody body;
    private final double markerSize;

    SolarSystemObject(final String label, final String ephemerisName, final double markerSize) {
        this.label = label;
        this.body = new EphemerisBody(ephemerisName);
        this.markerSize = markerSize;
    }

    public String label() {
        return label;
    }

    public EphemerisBody body() {
        return body;
    }

    public double markerSize() {
        return markerSize;
    }

    public static Optional<SolarSystemObject> byLabel(final String label) {
        return Arrays.stream(values()).filter(o -> o.label.equals(label)).findFirst();
    }

    public static double markerSize(final String label) {
        return byLabel(label).map(SolarSystemObject::markerSize).orElse(DEFAULT_MARKER_SIZE);
    }
}
