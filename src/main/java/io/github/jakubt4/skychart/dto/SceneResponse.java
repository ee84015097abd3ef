package io.github.jakubt4.skychart.dto;

import io.github.jakubt4.skychart.scene.FeatureFailure;
import io.github.jakubt4.skychart.scene.HorizontalCoordinate;
import io.github.jakubt4.skychart.scene.Polyline;
import io.github.jakubt4.skychart.scene.Scene;
import io.github.jakubt4.skychart.scene.SceneConstellation;
import io.github.jakubt4.skychart.scene.SceneLayout;
import io.github.jakubt4.skychart.scene.ScenePath;
import io.github.jakubt4.skychart.scene.ScenePoint;

import java.util.List;

/**
 * JSON view of a {@link Scene}. Azimuths are radians clockwise from north,
 * zenith angles degrees; the horizon is at zenith angle 90.
 *
 * @param when           local date-time of the scene, ISO-8601
 * @param theme          name of the theme the colors come from
 * @param layout         presentation flags
 * @param paths          solstice and today's Sun tracks
 * @param points         body markers
 * @param constellations projected constellation figures
 * @param failures       elements left out of the scene
 */
public record SceneResponse(String when,
                            String theme,
                            SceneLayout layout,
                            List<PathView> paths,
                            List<PointView> points,
                            List<ConstellationView> constellations,
                            List<FeatureFailure> failures) {

    public static SceneResponse from(final Scene scene) {
        return new SceneResponse(
                scene.when().toString(),
                scene.theme().name(),
                scene.layout(),
                scene.paths().stream().map(PathView::of).toList(),
                scene.points().stream().map(PointView::of).toList(),
                scene.constellations().stream().map(ConstellationView::of).toList(),
                scene.failures());
    }

    public record LineView(double[] azimuths, double[] zenithAngles) {

        static LineView of(final Polyline line) {
            return new LineView(line.azimuths(), line.zenithAngles());
        }
    }

    public record PathView(String name, String color, boolean dashed, double lineWidth, double alpha, LineView line) {

        static PathView of(final ScenePath path) {
            return new PathView(path.name(), path.color(), path.dashed(), path.lineWidth(), path.alpha(),
                    LineView.of(path.line()));
        }
    }

    public record PointView(String label, double azimuth, double zenithAngle, boolean visible,
                            String color, double size, boolean glow, boolean ringed) {

        static PointView of(final ScenePoint point) {
            final var position = point.position();
            return new PointView(point.label(), position.azimuth(), position.zenithAngle(),
                    !position.belowHorizon(), point.color(), point.size(), point.glow(), point.ringed());
        }
    }

    public record StarView(double azimuth, double zenithAngle) {

        static StarView of(final HorizontalCoordinate star) {
            return new StarView(star.azimuth(), star.zenithAngle());
        }
    }

    public record ConstellationView(String name, List<StarView> stars, List<LineView> lines) {

        static ConstellationView of(final SceneConstellation constellation) {
            return new ConstellationView(constellation.name(),
                    constellation.stars().stream().map(StarView::of).toList(),
                    constellation.lines().stream().map(LineView::of).toList());
        }
    }
}
