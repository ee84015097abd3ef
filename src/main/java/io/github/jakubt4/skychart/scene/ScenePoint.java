package io.github.jakubt4.skychart.scene;

/**
 * A body marker at its position for the scene's instant.
 *
 * @param label    display name, also the legend entry
 * @param position where the body is
 * @param color    hex color resolved from the theme
 * @param size     marker area in square points
 * @param glow     draw a translucent halo behind the marker
 * @param ringed   draw a ring across the marker (Saturn)
 */
public record ScenePoint(String label, HorizontalCoordinate position, String color,
                         double size, boolean glow, boolean ringed) {
}
