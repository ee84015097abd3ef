package io.github.jakubt4.skychart.controller;

import io.github.jakubt4.skychart.dto.SceneResponse;
import io.github.jakubt4.skychart.dto.ThemeRequest;
import io.github.jakubt4.skychart.dto.ThemeResponse;
import io.github.jakubt4.skychart.dto.ThemesResponse;
import io.github.jakubt4.skychart.service.SkyCameraService;
import io.github.jakubt4.skychart.sky.LocalizationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.util.List;

/**
 * REST endpoints of the sky camera.
 *
 * <p>{@code GET /api/sky/snapshot} serves the cached frame, or a fresh one for
 * {@code ?at=} (a local date-time in the observer zone). {@code GET /api/sky/scene}
 * serves the same frame as data. Themes are listed and switched under
 * {@code /api/sky/themes} and {@code /api/sky/theme}.
 */
@Slf4j
@RestController
@RequestMapping("/api/sky")
@RequiredArgsConstructor
public class SkyCameraController {

    private final SkyCameraService skyCameraService;

    /**
     * @return {@code 200 OK} with the encoded image, {@code 422 Unprocessable Entity} if
     *         {@code at} falls into a DST gap or fold, {@code 503 Service Unavailable} if
     *         the sky cannot be loaded or rendered
     */
    @GetMapping("/snapshot")
    public ResponseEntity<byte[]> snapshot(
            @RequestParam(name = "at", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) final LocalDateTime at) {
        try {
            final var frame = at == null ? skyCameraService.currentFrame() : skyCameraService.renderAt(at);
            return ResponseEntity.ok()
                    .contentType(MediaType.parseMediaType(frame.format().mediaType()))
                    .body(frame.image());
        } catch (final LocalizationException e) {
            log.warn("Snapshot rejected: {}", e.getMessage());
            return ResponseEntity.unprocessableEntity().build();
        } catch (final RuntimeException e) {
            log.error("Snapshot failed: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        }
    }

    /**
     * @return {@code 200 OK} with the scene as JSON; error statuses as for {@link #snapshot}
     */
    @GetMapping("/scene")
    public ResponseEntity<SceneResponse> scene(
            @RequestParam(name = "at", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) final LocalDateTime at) {
        try {
            return ResponseEntity.ok(SceneResponse.from(skyCameraService.scene(at)));
        } catch (final LocalizationException e) {
            log.warn("Scene rejected: {}", e.getMessage());
            return ResponseEntity.unprocessableEntity().build();
        } catch (final RuntimeException e) {
            log.error("Scene failed: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        }
    }

    @GetMapping("/themes")
    public ThemesResponse themes() {
        return new ThemesResponse(skyCameraService.activeTheme().name(), List.copyOf(skyCameraService.themes()));
    }

    /**
     * Switches the active theme. An unknown name is not an error: the default theme
     * takes over and the response reports {@code FALLBACK}.
     *
     * @return {@code 200 OK} with the theme now active, {@code 400 Bad Request} on a blank name
     */
    @PutMapping("/theme")
    public ResponseEntity<ThemeResponse> switchTheme(@RequestBody final ThemeRequest request) {
        if (request.name() == null || request.name().isBlank()) {
            return ResponseEntity.badRequest()
                    .body(new ThemeResponse(null, skyCameraService.activeTheme().name(), "REJECTED",
                            "Theme name is required"));
        }

        final var theme = skyCameraService.switchTheme(request.name());
        if (theme.name().equals(request.name())) {
            return ResponseEntity.ok(new ThemeResponse(request.name(), theme.name(), "ACTIVE", "Theme switched"));
        }
        return ResponseEntity.ok(new ThemeResponse(request.name(), theme.name(), "FALLBACK",
                "Unknown theme, using [" + theme.name() + "]"));
    }
}
