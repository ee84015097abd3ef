package io.github.jakubt4.skychart.scene;

import io.github.jakubt4.skychart.theme.Theme;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Everything needed to draw one frame. Built per render request and discarded after use.
 *
 * @param when           local date-time the positions were evaluated for
 * @param theme          theme snapshot every color in this scene was resolved from
 * @param layout         presentation flags
 * @param horizon        boundary circle at zenith angle 90
 * @param paths          winter solstice, summer solstice and today's Sun track, in that order
 * @param points         body markers
 * @param constellations projected constellation figures
 * @param failures       elements left out because they could not be assembled
 */
public record Scene(LocalDateTime when,
                    Theme theme,
                    SceneLayout layout,
                    ScenePath horizon,
                    List<ScenePath> paths,
                    List<ScenePoint> points,
                    List<SceneConstellation> constellations,
                    List<FeatureFailure> failures) {

    public Scene {
        paths = List.copyOf(paths);
        points = List.copyOf(points);
        constellations = List.copyOf(constellations);
        failures = List.copyOf(failures);
    }
}
