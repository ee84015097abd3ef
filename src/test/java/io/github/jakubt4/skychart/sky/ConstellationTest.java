package io.github.jakubt4.skychart.sky;

import io.github.jakubt4.skychart.ephemeris.AltAz;
import io.github.jakubt4.skychart.ephemeris.FixedStar;
import io.github.jakubt4.skychart.scene.ConstellationStyle;
import io.github.jakubt4.skychart.scene.HorizontalCoordinate;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ConstellationTest {

    private static final ConstellationStyle STYLE = new ConstellationStyle("#64CDFA", 10, 0.6, "#64CDFA", 0.5, 0.1);

    // declination doubles as altitude, right ascension as azimuth
    private final ObserverLocation observer = new ObserverLocation(0.0, 0.0, ZoneOffset.UTC,
            (target, instant) -> {
                final var star = (FixedStar) target;
                return new AltAz(star.decDegrees(), Math.toRadians(star.raHours() * 15.0));
            });

    private final CoordinateEngine engine = new CoordinateEngine();

    @Test
    void connectTakesShortWayAcrossNorth() {
        final var line = Constellation.connect(new HorizontalCoordinate(0.1, 40.0), new HorizontalCoordinate(6.2, 50.0));

        final var azimuths = line.azimuths();
        assertThat(line.size()).isEqualTo(Constellation.LINE_VERTICES);
        assertThat(azimuths[0]).isCloseTo(0.1 + CoordinateEngine.TWO_PI, within(1e-12));
        assertThat(azimuths[azimuths.length - 1]).isEqualTo(6.2);
        assertThat(Arrays.stream(azimuths).min().orElseThrow()).isGreaterThanOrEqualTo(6.2);
        assertThat(line.zenithAngles()[0]).isEqualTo(40.0);
        assertThat(line.zenithAngles()[azimuths.length - 1]).isEqualTo(50.0);
    }

    @Test
    void connectWrapsWhicheverEndIsSmaller() {
        final var line = Constellation.connect(new HorizontalCoordinate(6.2, 40.0), new HorizontalCoordinate(0.1, 50.0));

        final var azimuths = line.azimuths();
        assertThat(azimuths[0]).isEqualTo(6.2);
        assertThat(azimuths[azimuths.length - 1]).isCloseTo(0.1 + CoordinateEngine.TWO_PI, within(1e-12));
    }

    @Test
    void connectInterpolatesDirectlyWhenAzimuthsAreClose() {
        final var line = Constellation.connect(new HorizontalCoordinate(1.0, 10.0), new HorizontalCoordinate(2.0, 30.0));

        assertThat(line.azimuths()[0]).isEqualTo(1.0);
        assertThat(line.azimuths()[9]).isEqualTo(2.0);
        assertThat(line.zenithAngles()[9]).isEqualTo(30.0);
    }

    @Test
    void segmentBelowHorizonAtBothEndsIsCulled() {
        final var hidden = new Constellation("Hidden", List.of(segment(10.0, -5.0, 20.0, -5.0)));

        final var figure = hidden.project(engine, observer, Instant.EPOCH, STYLE);

        assertThat(figure.lines()).isEmpty();
        assertThat(figure.stars()).isEmpty();
    }

    @Test
    void segmentWithOneEndAboveHorizonIsKept() {
        final var rising = new Constellation("Rising", List.of(segment(10.0, -5.0, 20.0, 10.0)));

        final var figure = rising.project(engine, observer, Instant.EPOCH, STYLE);

        assertThat(figure.lines()).hasSize(1);
        assertThat(figure.stars()).extracting(HorizontalCoordinate::zenithAngle).containsExactly(95.0, 80.0);
    }

    @Test
    void sharedStarsAreEmittedOnce() {
        final var chain = new Constellation("Chain", List.of(
                segment(10.0, 20.0, 20.0, 30.0),
                segment(20.0, 30.0, 30.0, 40.0)));

        final var figure = chain.project(engine, observer, Instant.EPOCH, STYLE);

        assertThat(figure.stars()).hasSize(3);
        assertThat(figure.lines()).hasSize(2);
        assertThat(figure.name()).isEqualTo("Chain");
        assertThat(figure.style()).isEqualTo(STYLE);
    }

    private static ConstellationSegment segment(final double ra1, final double dec1,
                                                final double ra2, final double dec2) {
        return new ConstellationSegment(FixedStar.ofDegrees(ra1, dec1), FixedStar.ofDegrees(ra2, dec2));
    }
}
