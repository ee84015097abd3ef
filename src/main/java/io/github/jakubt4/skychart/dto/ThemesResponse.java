package io.github.jakubt4.skychart.dto;

import java.util.List;

/**
 * @param active    theme currently in effect
 * @param available every registered theme name, built-in first
 */
public record ThemesResponse(String active, List<String> available) {
}
