package io.github.jakubt4.skychart.theme;

import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Immutable, named set of style attributes.
 *
 * <p>A theme only stores the values its author supplied. Every lookup that the
 * theme cannot answer itself is delegated to its parent, which for user presets
 * is the built-in palette. Values that do not fit their key (a color that is not
 * hex, a size that is not a number) are dropped with a warning when the theme is
 * created, so they fall back the same way a missing key does.
 */
@Slf4j
public final class Theme {

    private static final Pattern HEX_COLOR = Pattern.compile("#(\\p{XDigit}{3}|\\p{XDigit}{6}|\\p{XDigit}{8})");
    private static final Set<String> FALSE_WORDS = Set.of("false", "no", "off", "0");

    static final String FALLBACK_PLANET_COLOR = "#f0f0f0";

    private final String name;
    private final Map<ThemeKey, Object> attributes;
    private final Map<String, String> planetColors;
    private final Theme parent;

    private Theme(final String name, final Map<ThemeKey, Object> attributes,
                  final Map<String, String> planetColors, final Theme parent) {
        this.name = name;
        this.attributes = Collections.unmodifiableMap(attributes);
        this.planetColors = Collections.unmodifiableMap(planetColors);
        this.parent = parent;
    }

    static Theme builtin(final String name, final Map<String, ?> values) {
        final var theme = of(name, values, null);
        for (final var key : ThemeKey.values()) {
            if (key != ThemeKey.PLANETS && !theme.attributes.containsKey(key)) {
                throw new IllegalStateException("Built-in theme does not define " + key.configName());
            }
        }
        return theme;
    }

    /**
     * Creates a theme from a raw (e.g. YAML-bound) mapping.
     *
     * @param parent theme to consult for keys this one does not define, {@code null} for a root theme
     */
    static Theme of(final String name, final Map<String, ?> values, final Theme parent) {
        final var attributes = new EnumMap<ThemeKey, Object>(ThemeKey.class);
        final var planets = new TreeMap<String, String>(String.CASE_INSENSITIVE_ORDER);

        if (values != null) {
            values.forEach((rawKey, value) -> {
                final var key = ThemeKey.fromConfigName(rawKey);
                if (key.isEmpty()) {
                    log.warn("Theme [{}]: ignoring unknown key '{}'", name, rawKey);
                    return;
                }
                switch (key.get().kind()) {
                    case COLOR -> putColor(name, key.get(), value, attributes);
                    case NUMBER -> putNumber(name, key.get(), value, attributes);
                    case FLAG -> attributes.put(key.get(), coerceFlag(value));
                    case PLANETS -> putPlanets(name, value, planets);
                }
            });
        }
        return new Theme(name, attributes, planets, parent);
    }

    private static void putColor(final String themeName, final ThemeKey key, final Object value,
                                 final Map<ThemeKey, Object> attributes) {
        if (isHexColor(value)) {
            attributes.put(key, value);
        } else {
            log.warn("Theme [{}]: '{}' is not a hex color for {}, using fallback", themeName, value, key.configName());
        }
    }

    private static void putNumber(final String themeName, final ThemeKey key, final Object value,
                                  final Map<ThemeKey, Object> attributes) {
        if (value instanceof Number number) {
            attributes.put(key, number.doubleValue());
            return;
        }
        try {
            attributes.put(key, Double.parseDouble(String.valueOf(value).trim()));
        } catch (final NumberFormatException e) {
            log.warn("Theme [{}]: '{}' is not a number for {}, using fallback", themeName, value, key.configName());
        }
    }

    private static void putPlanets(final String themeName, final Object value, final Map<String, String> planets) {
        if (!(value instanceof Map<?, ?> map)) {
            log.warn("Theme [{}]: 'planets' must be a mapping of body name to color, ignoring", themeName);
            return;
        }
        map.forEach((body, color) -> {
            if (isHexColor(color)) {
                planets.put(String.valueOf(body), (String) color);
            } else {
                log.warn("Theme [{}]: '{}' is not a hex color for planet {}, using fallback", themeName, color, body);
            }
        });
    }

    private static boolean isHexColor(final Object value) {
        return value instanceof String s && HEX_COLOR.matcher(s).matches();
    }

    /**
     * Strict boolean coercion: missing means {@code true}, {@code false/no/off/0} and
     * blank mean {@code false}, any other word means {@code true}.
     */
    static boolean coerceFlag(final Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value instanceof Number number) {
            return number.doubleValue() != 0.0;
        }
        final var word = String.valueOf(value).trim().toLowerCase(Locale.ROOT);
        if (FALSE_WORDS.contains(word)) {
            return false;
        }
        return !word.isEmpty();
    }

    public String name() {
        return name;
    }

    public boolean isBuiltin() {
        return parent == null;
    }

    public String color(final ThemeKey key) {
        return (String) lookup(key);
    }

    public double number(final ThemeKey key) {
        return (Double) lookup(key);
    }

    public boolean glow() {
        final var value = attributes.get(ThemeKey.GLOW);
        if (value != null) {
            return (Boolean) value;
        }
        return parent == null || parent.glow();
    }

    /**
     * Color for a body display name, falling back to the parent theme and then to
     * a neutral color for bodies no theme knows.
     */
    public String planetColor(final String body) {
        final var color = planetColors.get(body);
        if (color != null) {
            return color;
        }
        return parent != null ? parent.planetColor(body) : FALLBACK_PLANET_COLOR;
    }

    /**
     * Whether this theme itself (not its parent) sets {@code key}.
     */
    public boolean defines(final ThemeKey key) {
        return key == ThemeKey.PLANETS ? !planetColors.isEmpty() : attributes.containsKey(key);
    }

    private Object lookup(final ThemeKey key) {
        final var value = attributes.get(key);
        if (value != null) {
            return value;
        }
        if (parent == null) {
            throw new IllegalStateException("Theme [" + name + "] has no value for " + key.configName());
        }
        return parent.lookup(key);
    }

    @Override
    public String toString() {
        return "Theme[" + name + "]";
    }
}
