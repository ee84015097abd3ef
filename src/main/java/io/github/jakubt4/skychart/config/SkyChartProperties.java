package io.github.jakubt4.skychart.config;

import io.github.jakubt4.skychart.render.ImageFormat;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Sky chart settings bound from the {@code skychart} prefix.
 *
 * @param latitude           observer latitude, degrees north
 * @param longitude          observer longitude, degrees east
 * @param timeZone           observer time zone id, e.g. {@code Europe/Bratislava}
 * @param showConstellations draw constellation figures
 * @param showTime           stamp each frame with its local time
 * @param showLegend         draw the body legend
 * @param constellationsList constellation names to draw; unset draws the whole catalog
 * @param planetList         body labels to draw; unset or empty draws all
 * @param northUp            north at the top of the chart
 * @param horizontalFlip     counter-clockwise azimuth
 * @param imageType          encoding of served frames
 * @param defaultTheme       theme used when a requested one is unknown
 * @param colorPreset        theme active at start
 * @param colorPresets       named partial themes layered over the built-in palette
 * @param refreshInterval    period of the scheduled frame refresh
 * @param orekitData         Orekit data set, {@code classpath:<zip>} or a directory/zip path
 * @param imageWidth         frame width in pixels
 * @param imageHeight        frame height in pixels
 */
@ConfigurationProperties(prefix = "skychart")
public record SkyChartProperties(double latitude,
                                 double longitude,
                                 @DefaultValue("UTC") String timeZone,
                                 @DefaultValue("false") boolean showConstellations,
                                 @DefaultValue("true") boolean showTime,
                                 @DefaultValue("true") boolean showLegend,
                                 List<String> constellationsList,
                                 List<String> planetList,
                                 @DefaultValue("false") boolean northUp,
                                 @DefaultValue("false") boolean horizontalFlip,
                                 @DefaultValue("png") ImageFormat imageType,
                                 @DefaultValue("dark") String defaultTheme,
                                 String colorPreset,
                                 Map<String, Map<String, Object>> colorPresets,
                                 @DefaultValue("PT5M") Duration refreshInterval,
                                 @DefaultValue("classpath:orekit-data.zip") String orekitData,
                                 @DefaultValue("600") int imageWidth,
                                 @DefaultValue("620") int imageHeight) {
}
