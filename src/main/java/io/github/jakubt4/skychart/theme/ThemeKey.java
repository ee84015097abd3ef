package io.github.jakubt4.skychart.theme;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Style attributes a theme may define. Keys are matched on their normalized
 * form, so {@code background_outer}, {@code background-outer} and
 * {@code backgroundOuter} all address {@link #BACKGROUND_OUTER}.
 */
public enum ThemeKey {

    GLOW("glow", Kind.FLAG),
    BACKGROUND_OUTER("background_outer", Kind.COLOR),
    BACKGROUND_INNER("background_inner", Kind.COLOR),
    GRID_CIRCLE("grid_circle", Kind.COLOR),
    TEXT("text", Kind.COLOR),
    LEGEND_FACE("legend_face", Kind.COLOR),
    LEGEND_EDGE("legend_edge", Kind.COLOR),
    RGRID_COLOR("rgrid_color", Kind.COLOR),
    TGRID_COLOR("tgrid_color", Kind.COLOR),
    SUN_TODAY("sun_today", Kind.COLOR),
    SOLSTICE_WINTER("solstice_winter", Kind.COLOR),
    SOLSTICE_SUMMER("solstice_summer", Kind.COLOR),
    STAR_SIZE("star_size", Kind.NUMBER),
    STAR_COLOR("star_color", Kind.COLOR),
    STAR_ALPHA("star_alpha", Kind.NUMBER),
    CONSTELLATION_COLOR("constellation_color", Kind.COLOR),
    CONSTELLATION_LINEWIDTH("constellation_linewidth", Kind.NUMBER),
    CONSTELLATION_ALPHA("constellation_alpha", Kind.NUMBER),
    PLANETS("planets", Kind.PLANETS);

    enum Kind { COLOR, NUMBER, FLAG, PLANETS }

    private static final Map<String, ThemeKey> BY_NORMALIZED_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(key -> normalize(key.configName), Function.identity()));

    private final String configName;
    private final Kind kind;

    ThemeKey(final String configName, final Kind kind) {
        this.configName = configName;
        this.kind = kind;
    }

    public String configName() {
        return configName;
    }

    Kind kind() {
        return kind;
    }

    public static Optional<ThemeKey> fromConfigName(final String name) {
        return Optional.ofNullable(BY_NORMALIZED_NAME.get(normalize(name)));
    }

    static String normalize(final String name) {
        return name.replace("_", "").replace("-", "").toLowerCase(Locale.ROOT);
    }
}
