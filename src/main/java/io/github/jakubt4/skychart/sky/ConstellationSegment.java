package io.github.jakubt4.skychart.sky;

import io.github.jakubt4.skychart.ephemeris.FixedStar;

/**
 * One line of a constellation figure between two stars.
 */
public record ConstellationSegment(FixedStar start, FixedStar end) {
}
