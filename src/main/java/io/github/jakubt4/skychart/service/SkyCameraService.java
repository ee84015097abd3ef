package io.github.jakubt4.skychart.service;

import io.github.jakubt4.skychart.config.SkyChartProperties;
import io.github.jakubt4.skychart.render.ImageFormat;
import io.github.jakubt4.skychart.render.SkyChartRenderer;
import io.github.jakubt4.skychart.scene.Scene;
import io.github.jakubt4.skychart.sky.Sky;
import io.github.jakubt4.skychart.theme.Theme;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.LocalDateTime;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Camera over the sky: keeps the last encoded frame and refreshes it on a schedule.
 *
 * <p>The sky is loaded lazily by the first render, scheduled or requested. A failed
 * refresh keeps the previous frame; a theme switch drops it so the next poll
 * renders with the new colors. A cached frame is only served while its theme is
 * still the active one, so a refresh that raced a switch cannot pin old colors.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SkyCameraService {

    private final Sky sky;
    private final SkyChartRenderer renderer;
    private final SkyChartProperties properties;

    private final AtomicReference<CachedFrame> lastFrame = new AtomicReference<>();

    private record CachedFrame(CameraFrame frame, Theme theme) {
    }

    /**
     * An encoded frame.
     *
     * @param image      encoded bytes
     * @param format     encoding of {@code image}
     * @param renderedAt local date-time the frame shows
     */
    public record CameraFrame(byte[] image, ImageFormat format, LocalDateTime renderedAt) {
    }

    /**
     * Re-renders the cached frame for the current local time.
     */
    @Scheduled(fixedRateString = "${skychart.refresh-interval:PT5M}",
            initialDelayString = "${skychart.initial-delay:PT5S}")
    public void refresh() {
        try {
            final var when = sky.now();
            final var scene = scene(when);
            final var frame = encode(scene, when);
            if (scene.theme() == sky.activeTheme()) {
                lastFrame.set(new CachedFrame(frame, scene.theme()));
                log.debug("Frame refreshed for {}", frame.renderedAt());
            } else {
                log.debug("Discarding frame for {}, theme switched while rendering", frame.renderedAt());
            }
        } catch (final RuntimeException e) {
            log.error("Frame refresh failed, keeping previous frame: {}", e.getMessage());
        }
    }

    /**
     * Returns the cached frame, rendering one if none is cached yet.
     */
    public CameraFrame currentFrame() {
        final var cached = lastFrame.get();
        if (cached != null && cached.theme() == sky.activeTheme()) {
            return cached.frame();
        }
        final var when = sky.now();
        final var scene = scene(when);
        final var frame = encode(scene, when);
        if (scene.theme() == sky.activeTheme()) {
            lastFrame.compareAndSet(cached, new CachedFrame(frame, scene.theme()));
        }
        return frame;
    }

    /**
     * Renders a frame for {@code when} without touching the cache.
     *
     * @throws io.github.jakubt4.skychart.sky.LocalizationException if {@code when} does not exist
     *                                                              or is ambiguous in the observer zone
     */
    public CameraFrame renderAt(final LocalDateTime when) {
        return encode(scene(when), when);
    }

    private CameraFrame encode(final Scene scene, final LocalDateTime when) {
        final var format = properties.imageType();
        try {
            return new CameraFrame(renderer.render(scene, format), format, when);
        } catch (final IOException e) {
            throw new UncheckedIOException("Failed to encode " + format + " frame for " + when, e);
        }
    }

    /**
     * Assembles the scene for {@code when}, or for now when {@code null}.
     */
    public Scene scene(final LocalDateTime when) {
        sky.load();
        return sky.render(when == null ? sky.now() : when);
    }

    public Theme switchTheme(final String name) {
        final var theme = sky.setTheme(name);
        lastFrame.set(null);
        return theme;
    }

    public Theme activeTheme() {
        return sky.activeTheme();
    }

    public Set<String> themes() {
        return sky.themes().names();
    }
}
