package io.github.jakubt4.skychart.theme;

import java.util.Map;

import static java.util.Map.entry;

/**
 * The dark palette every theme ultimately falls back to. Defines every {@link ThemeKey}.
 */
final class BuiltinPalette {

    static final Map<String, Object> DARK = Map.ofEntries(
            entry("glow", true),
            entry("background_outer", "#020202"),
            entry("background_inner", "#1c1c1c"),
            entry("grid_circle", "#050505"),
            entry("text", "#f0f0f0"),
            entry("legend_face", "#2a2a2a"),
            entry("legend_edge", "#444444"),
            entry("rgrid_color", "#707070"),
            entry("tgrid_color", "#707070"),
            entry("sun_today", "#fff09a"),
            entry("solstice_winter", "#56b4e9"),
            entry("solstice_summer", "#009e73"),
            entry("star_size", 10),
            entry("star_color", "#64CDFA"),
            entry("star_alpha", 0.6),
            entry("constellation_color", "#64CDFA"),
            entry("constellation_linewidth", 0.5),
            entry("constellation_alpha", 0.1),
            entry("planets", Map.of(
                    "Sun", "#fff09a",
                    "Mercury", "#adbbc3",
                    "Venus", "#e5dbb6",
                    "Moon", "#999999",
                    "Mars", "#ef000f",
                    "Jupiter", "#e6b200",
                    "Saturn", "#ffb000",
                    "Uranus", "#00f9ff",
                    "Neptune", "#0079ff"
            ))
    );

    private BuiltinPalette() {
    }
}
