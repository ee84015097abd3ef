package io.github.jakubt4.skychart.scene;

/**
 * Presentation flags passed straight through to the renderer.
 *
 * @param showTime       annotate the frame with its timestamp
 * @param showLegend     draw a legend of the plotted bodies
 * @param northUp        north at the top of the chart instead of south
 * @param horizontalFlip azimuth increases counter-clockwise instead of clockwise
 */
public record SceneLayout(boolean showTime, boolean showLegend, boolean northUp, boolean horizontalFlip) {
}
