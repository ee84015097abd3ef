package io.github.jakubt4.skychart.sky;

import io.github.jakubt4.skychart.ephemeris.AltAz;
import io.github.jakubt4.skychart.ephemeris.EphemerisBody;
import io.github.jakubt4.skychart.ephemeris.SimpleSkyEphemeris;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class CoordinateEngineTest {

    private static final ZoneId NEW_YORK = ZoneId.of("America/New_York");

    private final CoordinateEngine engine = new CoordinateEngine();

    @Test
    void zenithAngleIsComplementOfAltitude() {
        final var observer = new ObserverLocation(0.0, 0.0, NEW_YORK, (target, instant) -> new AltAz(30.0, 1.0));

        final var position = engine.position(EphemerisBody.SUN, observer, Instant.EPOCH);

        assertThat(position.zenithAngle()).isEqualTo(60.0);
        assertThat(position.azimuth()).isEqualTo(1.0);
        assertThat(position.belowHorizon()).isFalse();
    }

    @Test
    void negativeAltitudeIsBelowHorizon() {
        final var observer = new ObserverLocation(0.0, 0.0, NEW_YORK, (target, instant) -> new AltAz(-12.0, 1.0));

        final var position = engine.position(EphemerisBody.SUN, observer, Instant.EPOCH);

        assertThat(position.zenithAngle()).isEqualTo(102.0);
        assertThat(position.belowHorizon()).isTrue();
    }

    @Test
    void azimuthIsNormalizedIntoOneTurn() {
        assertThat(CoordinateEngine.normalizeAzimuth(-0.5)).isCloseTo(CoordinateEngine.TWO_PI - 0.5, within(1e-12));
        assertThat(CoordinateEngine.normalizeAzimuth(3.0 * Math.PI)).isCloseTo(Math.PI, within(1e-12));
        assertThat(CoordinateEngine.normalizeAzimuth(CoordinateEngine.TWO_PI)).isEqualTo(0.0);
        assertThat(CoordinateEngine.normalizeAzimuth(0.0)).isEqualTo(0.0);
    }

    @Test
    void localDateTimeIsInterpretedInObserverZone() {
        final var seen = new AtomicReference<Instant>();
        final var observer = new ObserverLocation(0.0, 0.0, NEW_YORK, (target, instant) -> {
            seen.set(instant);
            return new AltAz(0.0, 0.0);
        });

        engine.position(EphemerisBody.SUN, observer, LocalDateTime.of(2024, 6, 21, 8, 0));

        assertThat(seen.get()).isEqualTo(Instant.parse("2024-06-21T12:00:00Z"));
    }

    @Test
    void localizeRejectsTimeInSpringForwardGap() {
        final var when = LocalDateTime.of(2024, 3, 10, 2, 30);

        assertThatThrownBy(() -> CoordinateEngine.localize(when, NEW_YORK))
                .isInstanceOf(LocalizationException.class)
                .hasMessageContaining("DST gap");
    }

    @Test
    void localizeRejectsTimeRepeatedByFallBack() {
        final var when = LocalDateTime.of(2024, 11, 3, 1, 30);

        assertThatThrownBy(() -> CoordinateEngine.localize(when, NEW_YORK))
                .isInstanceOf(LocalizationException.class)
                .hasMessageContaining("ambiguous");
    }

    @Test
    void sunAltitudeMatchesAlmanacForMorningObservation() {
        final var observer = new ObserverLocation(40.0, -75.0, NEW_YORK,
                new SimpleSkyEphemeris().observatory(40.0, -75.0));

        final var sun = engine.position(EphemerisBody.SUN, observer, Instant.parse("2024-06-21T12:00:00Z"));

        // about 8 am local solar time, Sun low in the east-northeast
        assertThat(sun.zenithAngle()).isCloseTo(64.0, within(1.5));
        assertThat(Math.toDegrees(sun.azimuth())).isBetween(70.0, 90.0);
    }
}
