package io.github.jakubt4.skychart.ephemeris;

/**
 * Loaded ephemeris dataset plus time scale, able to place observers on the Earth.
 */
public interface Ephemeris {

    /**
     * Binds a geodetic location (sea level) to this ephemeris.
     *
     * @param latitudeDegrees  geodetic latitude, degrees north
     * @param longitudeDegrees longitude, degrees east
     */
    Observatory observatory(double latitudeDegrees, double longitudeDegrees);
}
