package io.github.jakubt4.skychart.ephemeris;

/**
 * Something an {@link Observatory} can point at: a solar-system body looked up
 * in the ephemeris, or a fixed star given by its equatorial coordinates.
 */
public sealed interface CelestialTarget permits EphemerisBody, FixedStar {
}
