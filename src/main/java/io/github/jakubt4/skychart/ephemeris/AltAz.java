package io.github.jakubt4.skychart.ephemeris;

/**
 * Raw topocentric direction as reported by an ephemeris.
 *
 * @param altitudeDegrees elevation above the horizon, degrees
 * @param azimuthRadians  azimuth from north through east, radians
 */
public record AltAz(double altitudeDegrees, double azimuthRadians) {
}
