package io.github.jakubt4.skychart.config;

import io.github.jakubt4.skychart.ephemeris.EphemerisSource;
import io.github.jakubt4.skychart.ephemeris.OrekitEphemerisSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Exposes the Orekit data set (JPL ephemerides, Earth orientation parameters,
 * leap seconds) as the sky's {@link EphemerisSource}.
 *
 * <p>Nothing is read at startup. The data set is registered with Orekit's
 * {@link org.orekit.data.DataContext} on the first {@code Sky.load()}, so the
 * application starts without it and reports the failure per request instead.
 */
@Slf4j
@Configuration
public class OrekitConfig {

    /**
     * @param properties supplies {@code skychart.orekit-data}
     */
    @Bean
    EphemerisSource ephemerisSource(final SkyChartProperties properties) {
        log.info("Orekit data location: {}", properties.orekitData());
        return new OrekitEphemerisSource(properties.orekitData());
    }
}
