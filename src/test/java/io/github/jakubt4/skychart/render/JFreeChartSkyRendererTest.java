package io.github.jakubt4.skychart.render;

import io.github.jakubt4.skychart.scene.SceneLayout;
import org.jfree.chart.plot.PolarPlot;
import org.jfree.chart.title.LegendTitle;
import org.jfree.chart.title.TextTitle;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.awt.Font;
import java.awt.image.BufferedImage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assumptions.assumeThatCode;

class JFreeChartSkyRendererTest {

    private final JFreeChartSkyRenderer renderer = new JFreeChartSkyRenderer(300, 310);

    @Test
    void parsesShortLongAndAlphaHexColors() {
        assertThat(JFreeChartSkyRenderer.color("#abc", 1.0)).isEqualTo(new Color(0xaa, 0xbb, 0xcc, 255));
        assertThat(JFreeChartSkyRenderer.color("#56b4e9", 1.0)).isEqualTo(new Color(0x56, 0xb4, 0xe9, 255));
        assertThat(JFreeChartSkyRenderer.color("#ffffff", 0.2).getAlpha()).isEqualTo(51);
        assertThat(JFreeChartSkyRenderer.color("#00000080", 0.5).getAlpha()).isEqualTo(64);
    }

    @Test
    void everyElementBecomesItsOwnSeries() {
        final var chart = renderer.createChart(SceneFixtures.scene(new SceneLayout(true, true, false, false)));
        final var plot = (PolarPlot) chart.getPlot();

        // horizon, 2 tracks, 1 constellation line, 2 halos, 2 stars, 2 bodies, 1 ring
        assertThat(plot.getDataset().getSeriesCount()).isEqualTo(11);
        assertThat(plot.getDataset().getSeriesKey(0)).isEqualTo("horizon");
        assertThat(plot.getDataset().getSeriesKey(10)).isEqualTo("Saturn/ring");
    }

    @Test
    void orientationFollowsLayout() {
        final var southUp = (PolarPlot) renderer.createChart(
                SceneFixtures.scene(new SceneLayout(false, false, false, false))).getPlot();
        final var northUpFlipped = (PolarPlot) renderer.createChart(
                SceneFixtures.scene(new SceneLayout(false, false, true, true))).getPlot();

        assertThat(southUp.getAngleOffset()).isEqualTo(90.0);
        assertThat(southUp.isCounterClockwise()).isFalse();
        assertThat(northUpFlipped.getAngleOffset()).isEqualTo(-90.0);
        assertThat(northUpFlipped.isCounterClockwise()).isTrue();
    }

    @Test
    void legendAndTimestampAreOptional() {
        final var bare = renderer.createChart(SceneFixtures.scene(new SceneLayout(false, false, false, false)));
        final var full = renderer.createChart(SceneFixtures.scene(new SceneLayout(true, true, false, false)));

        assertThat(bare.getSubtitleCount()).isZero();
        assertThat(full.getSubtitleCount()).isEqualTo(2);
        assertThat(full.getSubtitle(0)).isInstanceOf(LegendTitle.class);
        assertThat(((LegendTitle) full.getSubtitle(0)).getSources()[0].getLegendItems().getItemCount()).isEqualTo(2);
        assertThat(((TextTitle) full.getSubtitle(1)).getText()).isEqualTo("2024-06-21 08:00:00");
    }

    @Test
    void themeColorsThePlot() {
        final var chart = renderer.createChart(SceneFixtures.scene(new SceneLayout(false, false, false, false)));

        assertThat(chart.getBackgroundPaint()).isEqualTo(new Color(0x02, 0x02, 0x02));
        assertThat(chart.getPlot().getBackgroundPaint()).isEqualTo(new Color(0x1c, 0x1c, 0x1c));
    }

    @Test
    void encodesPngAndJpeg() throws Exception {
        assumeThatCode(() -> new BufferedImage(1, 1, BufferedImage.TYPE_INT_RGB).createGraphics()
                .getFontMetrics(new Font(Font.SANS_SERIF, Font.PLAIN, 10)).stringWidth("N"))
                .doesNotThrowAnyException();
        final var scene = SceneFixtures.scene(new SceneLayout(true, true, false, false));

        final var png = renderer.render(scene, ImageFormat.PNG);
        final var jpeg = renderer.render(scene, ImageFormat.JPEG);

        assertThat(png).startsWith((byte) 0x89, (byte) 'P', (byte) 'N', (byte) 'G');
        assertThat(jpeg).startsWith((byte) 0xFF, (byte) 0xD8);
    }
}
