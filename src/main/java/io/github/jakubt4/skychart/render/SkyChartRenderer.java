package io.github.jakubt4.skychart.render;

import io.github.jakubt4.skychart.scene.Scene;

import java.io.IOException;

/**
 * Turns an assembled {@link Scene} into an encoded image.
 */
public interface SkyChartRenderer {

    byte[] render(Scene scene, ImageFormat format) throws IOException;
}
