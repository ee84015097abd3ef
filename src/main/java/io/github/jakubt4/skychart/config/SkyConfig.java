package io.github.jakubt4.skychart.config;

import io.github.jakubt4.skychart.ephemeris.EphemerisSource;
import io.github.jakubt4.skychart.render.JFreeChartSkyRenderer;
import io.github.jakubt4.skychart.render.SkyChartRenderer;
import io.github.jakubt4.skychart.sky.ConstellationCatalog;
import io.github.jakubt4.skychart.sky.Sky;
import io.github.jakubt4.skychart.sky.SkyOptions;
import io.github.jakubt4.skychart.theme.ThemeResolver;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Wires the sky engine, its constellation catalog, theme registry and chart renderer
 * from {@link SkyChartProperties}.
 */
@Configuration
@EnableConfigurationProperties(SkyChartProperties.class)
public class SkyConfig {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    ThemeResolver themeResolver(final SkyChartProperties properties) {
        return new ThemeResolver(properties.defaultTheme(), properties.colorPresets());
    }

    @Bean
    ConstellationCatalog constellationCatalog() {
        return ConstellationCatalog.fromClasspath(ConstellationCatalog.DEFAULT_RESOURCE);
    }

    @Bean
    Sky sky(final SkyChartProperties properties, final EphemerisSource ephemerisSource,
            final ConstellationCatalog catalog, final ThemeResolver themes, final Clock clock) {
        final var options = new SkyOptions(
                properties.latitude(),
                properties.longitude(),
                ZoneId.of(properties.timeZone()),
                properties.showConstellations(),
                properties.showTime(),
                properties.showLegend(),
                properties.constellationsList(),
                properties.planetList(),
                properties.northUp(),
                properties.horizontalFlip(),
                properties.colorPreset());
        return new Sky(options, ephemerisSource, catalog, themes, clock);
    }

    @Bean
    SkyChartRenderer skyChartRenderer(final SkyChartProperties properties) {
        return new JFreeChartSkyRenderer(properties.imageWidth(), properties.imageHeight());
    }
}
