package io.github.jakubt4.skychart.sky;

import io.github.jakubt4.skychart.scene.SceneLayout;

import java.time.ZoneId;
import java.util.List;

/**
 * What to draw and for whom.
 *
 * @param latitude           observer latitude, degrees north
 * @param longitude          observer longitude, degrees east
 * @param zone               observer time zone
 * @param showConstellations build and draw constellation figures
 * @param showTime           annotate frames with their timestamp
 * @param showLegend         draw a legend of the plotted bodies
 * @param constellationList  constellation names to draw, {@code null} for the whole catalog
 * @param planetList         body labels to draw, {@code null} or empty for all
 * @param northUp            north at the top of the chart
 * @param horizontalFlip     counter-clockwise azimuth
 * @param colorPreset        theme active at start, {@code null} for the default theme
 */
public record SkyOptions(double latitude,
                         double longitude,
                         ZoneId zone,
                         boolean showConstellations,
                         boolean showTime,
                         boolean showLegend,
                         List<String> constellationList,
                         List<String> planetList,
                         boolean northUp,
                         boolean horizontalFlip,
                         String colorPreset) {

    public SceneLayout layout() {
        return new SceneLayout(showTime, showLegend, northUp, horizontalFlip);
    }
}
