package io.github.jakubt4.skychart.ephemeris;

/**
 * Solar-system body resolved by name against the loaded ephemeris.
 *
 * @param name ephemeris identifier, e.g. {@code "sun"} or {@code "jupiter barycenter"}
 */
public record EphemerisBody(String name) implements CelestialTarget {

    public static final EphemerisBody SUN = new EphemerisBody("sun");
}
