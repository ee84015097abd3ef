package io.github.jakubt4.skychart.theme;

import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Registry of named themes: the built-in {@value #BUILTIN_THEME_NAME} palette plus
 * user presets layered on top of it.
 *
 * <p>Resolution never fails. A requested name that is not registered resolves to
 * the configured default theme, and if that is not registered either, to the
 * built-in palette. A preset named {@value #BUILTIN_THEME_NAME} replaces the
 * registry entry, but its missing keys still come from the built-in values.
 */
@Slf4j
public class ThemeResolver {

    public static final String BUILTIN_THEME_NAME = "dark";

    private final Theme builtin;
    private final Map<String, Theme> registry;
    private final String defaultThemeName;

    public ThemeResolver(final String defaultThemeName, final Map<String, ? extends Map<String, ?>> presets) {
        this.builtin = Theme.builtin(BUILTIN_THEME_NAME, BuiltinPalette.DARK);
        this.defaultThemeName = defaultThemeName == null ? BUILTIN_THEME_NAME : defaultThemeName;

        final var themes = new LinkedHashMap<String, Theme>();
        themes.put(BUILTIN_THEME_NAME, builtin);
        if (presets != null) {
            presets.forEach((name, values) -> themes.put(name, Theme.of(name, values, builtin)));
        }
        this.registry = Collections.unmodifiableMap(themes);

        if (!registry.containsKey(this.defaultThemeName)) {
            log.warn("Default theme [{}] is not defined, falling back to [{}]", this.defaultThemeName, BUILTIN_THEME_NAME);
        }
        log.info("Theme registry initialized — themes={}, default={}", registry.keySet(), this.defaultThemeName);
    }

    /**
     * Looks up {@code name}, then the default theme, then the built-in palette.
     *
     * @param name requested theme, may be {@code null}
     */
    public Theme resolve(final String name) {
        if (name != null) {
            final var theme = registry.get(name);
            if (theme != null) {
                return theme;
            }
            log.warn("Unknown theme [{}], using default [{}]", name, defaultThemeName);
        }
        return registry.getOrDefault(defaultThemeName, builtin);
    }

    public Theme builtin() {
        return builtin;
    }

    public String defaultThemeName() {
        return defaultThemeName;
    }

    public Set<String> names() {
        return registry.keySet();
    }
}
