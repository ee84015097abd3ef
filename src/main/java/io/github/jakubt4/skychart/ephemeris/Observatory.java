package io.github.jakubt4.skychart.ephemeris;

import java.time.Instant;

/**
 * A fixed place on the Earth's surface bound to an ephemeris.
 */
@FunctionalInterface
public interface Observatory {

    /**
     * Apparent direction of {@code target} as seen from this place.
     *
     * @throws IllegalArgumentException if the ephemeris does not know the target
     */
    AltAz observe(CelestialTarget target, Instant instant);
}
