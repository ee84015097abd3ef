package io.github.jakubt4.skychart.scene;

public record ConstellationStyle(String starColor, double starSize, double starAlpha,
                                 String lineColor, double lineWidth, double lineAlpha) {
}
