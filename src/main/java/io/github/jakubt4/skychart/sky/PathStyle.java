package io.github.jakubt4.skychart.sky;

import io.github.jakubt4.skychart.theme.ThemeKey;

/**
 * How a {@link BodyPath} is stroked. The color is a theme key so the path can be
 * restyled by a theme switch without resampling.
 */
public record PathStyle(ThemeKey colorKey, boolean dashed, double lineWidth, double alpha) {
}
