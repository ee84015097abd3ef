package io.github.jakubt4.skychart.scene;

/**
 * A styled polyline: a day-long body track, or the horizon circle.
 *
 * @param name      identifier, e.g. {@code "today"} or {@code "winter-solstice"}
 * @param line      the vertices
 * @param color     hex color resolved from the theme
 * @param dashed    dashed rather than solid stroke
 * @param lineWidth stroke width in points
 * @param alpha     opacity, {@code [0, 1]}
 */
public record ScenePath(String name, Polyline line, String color, boolean dashed, double lineWidth, double alpha) {
}
