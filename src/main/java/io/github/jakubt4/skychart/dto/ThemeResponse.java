package io.github.jakubt4.skychart.dto;

/**
 * Response returned after a theme switch attempt.
 *
 * @param requested theme name that was asked for (may be {@code null} on early rejection)
 * @param active    theme now in effect
 * @param status    outcome — {@code "ACTIVE"} if the requested theme is in effect,
 *                  {@code "FALLBACK"} if another theme replaced it, {@code "REJECTED"} otherwise
 * @param message   human-readable detail about the result
 */
public record ThemeResponse(String requested, String active, String status, String message) {
}
