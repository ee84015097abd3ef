package io.github.jakubt4.skychart.scene;

/**
 * A scene element that could not be assembled and was left out of the frame.
 *
 * @param feature name of the element, e.g. a constellation name
 * @param message cause
 */
public record FeatureFailure(String feature, String message) {
}
