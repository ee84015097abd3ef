package io.github.jakubt4.skychart.sky;

import io.github.jakubt4.skychart.ephemeris.Observatory;

import java.time.ZoneId;

/**
 * The one place the sky is drawn for.
 *
 * @param latitude    degrees north
 * @param longitude   degrees east
 * @param zone        zone naive local date-times are interpreted in
 * @param observatory the location bound to the loaded ephemeris
 */
public record ObserverLocation(double latitude, double longitude, ZoneId zone, Observatory observatory) {
}
