package io.github.jakubt4.skychart.ephemeris;

/**
 * Acquires the ephemeris dataset. Acquisition may be expensive (data files,
 * time scale tables), callers are expected to do it once.
 */
@FunctionalInterface
public interface EphemerisSource {

    Ephemeris load();
}
