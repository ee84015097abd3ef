package io.github.jakubt4.skychart;

import io.github.jakubt4.skychart.config.SkyChartProperties;
import io.github.jakubt4.skychart.ephemeris.EphemerisSource;
import io.github.jakubt4.skychart.ephemeris.SimpleSkyEphemeris;
import io.github.jakubt4.skychart.service.SkyCameraService;
import io.github.jakubt4.skychart.sky.Sky;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@SpringBootTest
class SkyChartApplicationTests {

    @MockBean
    private EphemerisSource ephemerisSource;

    @Autowired
    private SkyChartProperties properties;

    @Autowired
    private Sky sky;

    @Autowired
    private SkyCameraService skyCameraService;

    @Test
    void bindsConfigurationWithDefaults() {
        assertThat(properties.latitude()).isEqualTo(40.0);
        assertThat(properties.timeZone()).isEqualTo("America/New_York");
        assertThat(properties.imageWidth()).isEqualTo(600);
        assertThat(properties.showTime()).isTrue();
        assertThat(properties.colorPresets()).containsKey("light");
        assertThat(sky.themes().names()).containsExactly("dark", "light");
    }

    @Test
    void sceneIsAssembledThroughTheWiredBeans() {
        when(ephemerisSource.load()).thenReturn(new SimpleSkyEphemeris());

        final var scene = skyCameraService.scene(LocalDateTime.of(2024, 6, 21, 8, 0));

        assertThat(sky.state()).isEqualTo(Sky.State.READY);
        assertThat(scene.points()).hasSize(9);
        assertThat(scene.constellations()).isNotEmpty();
        assertThat(scene.failures()).isEmpty();
    }
}
