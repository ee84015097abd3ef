package io.github.jakubt4.skychart.ephemeris;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIf;

import java.io.File;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Checks the Orekit adapter against the analytic fixture. Needs an unpacked Orekit
 * data set, taken from {@code -Dorekit.data.path} or {@code ~/orekit-data}.
 */
@EnabledIf("orekitDataPresent")
class OrekitEphemerisTest {

    // the fixture ignores precession since J2000, about 0.6 degrees of azimuth here
    private static final double TOLERANCE_DEGREES = 1.0;
    private static final double LATITUDE = 40.0;
    private static final double LONGITUDE = -75.0;

    private static Observatory observatory;

    @BeforeAll
    static void loadEphemeris() {
        observatory = new OrekitEphemerisSource(dataDirectory().getPath()).load().observatory(LATITUDE, LONGITUDE);
    }

    @Test
    void fixedStarMatchesSiderealRotation() {
        final var betelgeuse = FixedStar.ofDegrees(88.79, 7.41);
        final var instant = Instant.parse("2024-01-15T03:00:00Z");

        assertMatchesFixture(betelgeuse, instant);
        assertThat(observatory.observe(betelgeuse, instant).altitudeDegrees()).isCloseTo(57.14, within(TOLERANCE_DEGREES));
    }

    @Test
    void azimuthIsMeasuredFromNorthThroughEast() {
        final var vega = FixedStar.ofDegrees(279.23, 38.78);
        final var instant = Instant.parse("2024-06-21T12:00:00Z");

        final var observed = observatory.observe(vega, instant);

        assertThat(Math.toDegrees(observed.azimuthRadians())).isCloseTo(304.44, within(TOLERANCE_DEGREES));
        assertMatchesFixture(vega, instant);
    }

    @Test
    void sunMatchesAlmanacPosition() {
        final var instant = Instant.parse("2024-06-21T12:00:00Z");

        final var observed = observatory.observe(EphemerisBody.SUN, instant);

        assertThat(observed.altitudeDegrees()).isCloseTo(25.58, within(TOLERANCE_DEGREES));
        assertThat(Math.toDegrees(observed.azimuthRadians())).isCloseTo(79.99, within(TOLERANCE_DEGREES));
    }

    private static void assertMatchesFixture(final CelestialTarget target, final Instant instant) {
        final var expected = SimpleSkyEphemeris.observe(target, instant, LATITUDE, LONGITUDE);
        final var actual = observatory.observe(target, instant);

        assertThat(actual.altitudeDegrees()).isCloseTo(expected.altitudeDegrees(), within(TOLERANCE_DEGREES));
        assertThat(Math.toDegrees(actual.azimuthRadians()))
                .isCloseTo(Math.toDegrees(expected.azimuthRadians()), within(TOLERANCE_DEGREES));
    }

    static boolean orekitDataPresent() {
        return dataDirectory().isDirectory();
    }

    private static File dataDirectory() {
        final var configured = System.getProperty("orekit.data.path");
        if (configured != null) {
            return new File(configured);
        }
        return new File(System.getProperty("user.home"), "orekit-data");
    }
}
