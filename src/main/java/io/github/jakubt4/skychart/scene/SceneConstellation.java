package io.github.jakubt4.skychart.scene;

import java.util.List;

/**
 * A constellation figure projected for the scene's instant.
 *
 * @param name  constellation name as it appears in the catalog
 * @param stars distinct star markers, in first-seen order
 * @param lines one polyline per visible segment, wraparound-corrected
 * @param style theme-derived appearance
 */
public record SceneConstellation(String name, List<HorizontalCoordinate> stars,
                                 List<Polyline> lines, ConstellationStyle style) {

    public SceneConstellation {
        stars = List.copyOf(stars);
        lines = List.copyOf(lines);
    }
}
