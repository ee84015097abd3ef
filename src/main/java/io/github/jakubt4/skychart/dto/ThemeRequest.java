package io.github.jakubt4.skychart.dto;

/**
 * Inbound request to switch the active theme.
 *
 * @param name theme to activate; unknown names fall back to the default theme
 */
public record ThemeRequest(String name) {
}
