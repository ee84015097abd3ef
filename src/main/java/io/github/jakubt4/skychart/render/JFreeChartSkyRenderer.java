package io.github.jakubt4.skychart.render;

import io.github.jakubt4.skychart.scene.HorizontalCoordinate;
import io.github.jakubt4.skychart.scene.Polyline;
import io.github.jakubt4.skychart.scene.Scene;
import io.github.jakubt4.skychart.scene.SceneConstellation;
import io.github.jakubt4.skychart.scene.ScenePath;
import io.github.jakubt4.skychart.theme.Theme;
import io.github.jakubt4.skychart.theme.ThemeKey;
import lombok.extern.slf4j.Slf4j;
import org.jfree.chart.ChartUtils;
import org.jfree.chart.JFreeChart;
import org.jfree.chart.LegendItem;
import org.jfree.chart.LegendItemCollection;
import org.jfree.chart.axis.CompassFormat;
import org.jfree.chart.axis.NumberAxis;
import org.jfree.chart.axis.NumberTickUnit;
import org.jfree.chart.block.BlockBorder;
import org.jfree.chart.plot.PolarPlot;
import org.jfree.chart.renderer.DefaultPolarItemRenderer;
import org.jfree.chart.title.LegendTitle;
import org.jfree.chart.title.TextTitle;
import org.jfree.chart.ui.HorizontalAlignment;
import org.jfree.chart.ui.RectangleEdge;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.Shape;
import java.awt.Stroke;
import java.awt.geom.Ellipse2D;
import java.awt.geom.Rectangle2D;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.format.DateTimeFormatter;

/**
 * Draws a scene on a JFreeChart {@link PolarPlot}: angle is azimuth, radius is
 * zenith angle, so the zenith sits at the centre and the horizon on the rim.
 *
 * <p>Every path, constellation segment and marker is its own series, drawn in
 * series order: horizon, tracks, constellation lines, halos, stars, bodies, rings.
 * Marker sizes are areas in square points, as in the scene.
 */
@Slf4j
public class JFreeChartSkyRenderer implements SkyChartRenderer {

    // 0° of azimuth at 12 o'clock (north up) or at 6 o'clock (south up)
    private static final double NORTH_UP_OFFSET = -90.0;
    private static final double SOUTH_UP_OFFSET = 90.0;

    private static final double PIXELS_PER_POINT = 100.0 / 72.0;
    private static final double GLOW_AREA_SCALE = 3.5;
    private static final double GLOW_ALPHA = 0.2;
    private static final double RING_AREA_SCALE = 2.0;
    private static final double LEGEND_AREA_SCALE = 0.36;
    private static final Shape NO_SHAPE = new Rectangle2D.Double();
    private static final Font TIME_FONT = new Font(Font.SANS_SERIF, Font.PLAIN, 10);
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final int width;
    private final int height;

    public JFreeChartSkyRenderer(final int width, final int height) {
        this.width = width;
        this.height = height;
    }

    @Override
    public byte[] render(final Scene scene, final ImageFormat format) throws IOException {
        final var chart = createChart(scene);
        final var out = new ByteArrayOutputStream();
        switch (format) {
            case PNG -> ChartUtils.writeChartAsPNG(out, chart, width, height);
            case JPEG -> ChartUtils.writeChartAsJPEG(out, chart, width, height);
        }
        log.debug("Rendered {} frame for {} — {} bytes", format, scene.when(), out.size());
        return out.toByteArray();
    }

    JFreeChart createChart(final Scene scene) {
        final var theme = scene.theme();
        final var layers = new Layers();

        layers.addLine(scene.horizon());
        scene.paths().forEach(layers::addLine);
        for (final var constellation : scene.constellations()) {
            layers.addConstellationLines(constellation);
        }
        for (final var point : scene.points()) {
            if (point.glow()) {
                layers.addMarker(point.label() + "/glow", point.position(),
                        disc(point.size() * GLOW_AREA_SCALE), color(point.color(), GLOW_ALPHA));
            }
        }
        for (final var constellation : scene.constellations()) {
            layers.addConstellationStars(constellation);
        }
        for (final var point : scene.points()) {
            final var paint = color(point.color(), 1.0);
            layers.addMarker(point.label(), point.position(), disc(point.size()), paint);
            layers.legend.add(new LegendItem(point.label(), null, null, null, disc(point.size() * LEGEND_AREA_SCALE), paint));
        }
        for (final var point : scene.points()) {
            if (point.ringed()) {
                layers.addMarker(point.label() + "/ring", point.position(), ring(point.size()), color(point.color(), 1.0));
            }
        }

        final var plot = new PolarPlot(layers.dataset, radiusAxis(theme), layers.renderer);
        plot.setBackgroundPaint(color(theme.color(ThemeKey.BACKGROUND_INNER), 1.0));
        plot.setOutlineVisible(false);
        plot.setAngleGridlinePaint(color(theme.color(ThemeKey.TGRID_COLOR), 1.0));
        plot.setRadiusGridlinePaint(color(theme.color(ThemeKey.RGRID_COLOR), 1.0));
        plot.setAngleLabelPaint(color(theme.color(ThemeKey.TGRID_COLOR), 1.0));
        plot.setAngleTickUnit(new NumberTickUnit(45.0, new CompassFormat()));
        plot.setAngleOffset(scene.layout().northUp() ? NORTH_UP_OFFSET : SOUTH_UP_OFFSET);
        plot.setCounterClockwise(scene.layout().horizontalFlip());

        final var chart = new JFreeChart(null, JFreeChart.DEFAULT_TITLE_FONT, plot, false);
        chart.setBackgroundPaint(color(theme.color(ThemeKey.BACKGROUND_OUTER), 1.0));

        if (scene.layout().showLegend()) {
            chart.addSubtitle(legend(theme, layers.legend));
        }
        if (scene.layout().showTime()) {
            final var timestamp = new TextTitle(TIME_FORMAT.format(scene.when()), TIME_FONT);
            timestamp.setPaint(color(theme.color(ThemeKey.TEXT), 1.0));
            timestamp.setPosition(RectangleEdge.BOTTOM);
            timestamp.setHorizontalAlignment(HorizontalAlignment.LEFT);
            chart.addSubtitle(timestamp);
        }
        return chart;
    }

    private static NumberAxis radiusAxis(final Theme theme) {
        final var paint = color(theme.color(ThemeKey.RGRID_COLOR), 1.0);
        final var axis = new NumberAxis();
        axis.setRange(0.0, HorizontalCoordinate.HORIZON);
        axis.setTickUnit(new NumberTickUnit(10.0, new AltitudeFormat()));
        axis.setTickLabelPaint(paint);
        axis.setAxisLinePaint(paint);
        return axis;
    }

    private static LegendTitle legend(final Theme theme, final LegendItemCollection items) {
        final var legend = new LegendTitle(() -> items);
        legend.setItemPaint(color(theme.color(ThemeKey.TEXT), 1.0));
        legend.setBackgroundPaint(color(theme.color(ThemeKey.LEGEND_FACE), 1.0));
        legend.setFrame(new BlockBorder(color(theme.color(ThemeKey.LEGEND_EDGE), 1.0)));
        legend.setPosition(RectangleEdge.BOTTOM);
        legend.setHorizontalAlignment(HorizontalAlignment.RIGHT);
        return legend;
    }

    private static Shape disc(final double area) {
        final var diameter = Math.sqrt(area) * PIXELS_PER_POINT;
        return new Ellipse2D.Double(-diameter / 2, -diameter / 2, diameter, diameter);
    }

    private static Shape ring(final double area) {
        final var length = Math.sqrt(area * RING_AREA_SCALE) * PIXELS_PER_POINT;
        return new Rectangle2D.Double(-length / 2, -0.75, length, 1.5);
    }

    /**
     * Parses {@code #rgb}, {@code #rrggbb} or {@code #rrggbbaa}, scaling the color's
     * own alpha by {@code alpha}.
     */
    static Color color(final String hex, final double alpha) {
        var digits = hex.substring(1);
        if (digits.length() == 3) {
            digits = new StringBuilder()
                    .append(digits.charAt(0)).append(digits.charAt(0))
                    .append(digits.charAt(1)).append(digits.charAt(1))
                    .append(digits.charAt(2)).append(digits.charAt(2))
                    .toString();
        }
        final var rgb = Integer.parseInt(digits.substring(0, 6), 16);
        final var ownAlpha = digits.length() == 8 ? Integer.parseInt(digits.substring(6, 8), 16) / 255.0 : 1.0;
        final var combined = Math.max(0.0, Math.min(1.0, alpha * ownAlpha));
        return new Color((rgb >> 16) & 0xFF, (rgb >> 8) & 0xFF, rgb & 0xFF, (int) Math.round(combined * 255));
    }

    private static Stroke stroke(final double width, final boolean dashed) {
        if (dashed) {
            return new BasicStroke((float) width, BasicStroke.CAP_BUTT, BasicStroke.JOIN_ROUND,
                    10.0f, new float[]{6.0f, 4.0f}, 0.0f);
        }
        return new BasicStroke((float) width, BasicStroke.CAP_ROUND, BasicStroke.JOIN_ROUND);
    }

    /**
     * Dataset and renderer being filled series by series.
     */
    private static final class Layers {

        private final XYSeriesCollection dataset = new XYSeriesCollection();
        private final DefaultPolarItemRenderer renderer = new DefaultPolarItemRenderer();
        private final LegendItemCollection legend = new LegendItemCollection();

        private Layers() {
            renderer.setShapesVisible(true);
            renderer.setUseFillPaint(true);
            renderer.setConnectFirstAndLastPoint(false);
        }

        void addLine(final ScenePath path) {
            addLine(path.name(), path.line(), color(path.color(), path.alpha()), stroke(path.lineWidth(), path.dashed()));
        }

        void addConstellationLines(final SceneConstellation constellation) {
            final var style = constellation.style();
            final var paint = color(style.lineColor(), style.lineAlpha());
            final var stroke = stroke(style.lineWidth(), false);
            for (var i = 0; i < constellation.lines().size(); i++) {
                addLine(constellation.name() + "/line/" + i, constellation.lines().get(i), paint, stroke);
            }
        }

        void addConstellationStars(final SceneConstellation constellation) {
            final var style = constellation.style();
            final var paint = color(style.starColor(), style.starAlpha());
            final var shape = disc(style.starSize());
            for (var i = 0; i < constellation.stars().size(); i++) {
                addMarker(constellation.name() + "/star/" + i, constellation.stars().get(i), shape, paint);
            }
        }

        void addMarker(final String key, final HorizontalCoordinate position, final Shape shape, final Color paint) {
            final var series = new XYSeries(key, false, true);
            series.add(Math.toDegrees(position.azimuth()), position.zenithAngle());
            final var index = add(series);
            renderer.setSeriesShape(index, shape);
            renderer.setSeriesFillPaint(index, paint);
            renderer.setSeriesPaint(index, paint);
        }

        private void addLine(final String key, final Polyline line, final Color paint, final Stroke stroke) {
            final var series = new XYSeries(key, false, true);
            final var azimuths = line.azimuths();
            final var zeniths = line.zenithAngles();
            for (var i = 0; i < azimuths.length; i++) {
                series.add(Math.toDegrees(azimuths[i]), zeniths[i]);
            }
            final var index = add(series);
            renderer.setSeriesPaint(index, paint);
            renderer.setSeriesStroke(index, stroke);
            renderer.setSeriesShape(index, NO_SHAPE);
        }

        private int add(final XYSeries series) {
            dataset.addSeries(series);
            return dataset.getSeriesCount() - 1;
        }
    }
}
