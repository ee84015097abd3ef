package io.github.jakubt4.skychart.ephemeris;

import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.orekit.bodies.CelestialBody;
import org.orekit.bodies.GeodeticPoint;
import org.orekit.bodies.OneAxisEllipsoid;
import org.orekit.frames.Frame;
import org.orekit.frames.TopocentricFrame;
import org.orekit.time.AbsoluteDate;
import org.orekit.time.TimeScale;

import java.time.Instant;
import java.util.Date;
import java.util.Map;

/**
 * Orekit-backed ephemeris. Bodies come from the JPL DE tables registered with
 * Orekit; fixed stars are directions in GCRF placed far enough away that the
 * observer's offset from the geocenter is irrelevant.
 *
 * <p>Positions are geometric: light time and aberration are not applied.
 */
final class OrekitEphemeris implements Ephemeris {

    // ~10 000 light years, in metres
    private static final double STAR_DISTANCE = 1.0e20;

    private final TimeScale utc;
    private final OneAxisEllipsoid earth;
    private final Frame inertial;
    private final Map<String, CelestialBody> bodies;

    OrekitEphemeris(final TimeScale utc, final OneAxisEllipsoid earth,
                    final Frame inertial, final Map<String, CelestialBody> bodies) {
        this.utc = utc;
        this.earth = earth;
        this.inertial = inertial;
        this.bodies = bodies;
    }

    @Override
    public Observatory observatory(final double latitudeDegrees, final double longitudeDegrees) {
        final var site = new GeodeticPoint(Math.toRadians(latitudeDegrees), Math.toRadians(longitudeDegrees), 0.0);
        final var topocentric = new TopocentricFrame(earth, site, "observer");

        return (target, instant) -> {
            final var date = toDate(instant);
            final var point = positionOf(target, date);
            final var elevation = topocentric.getElevation(point, inertial, date);
            final var azimuth = topocentric.getAzimuth(point, inertial, date);
            return new AltAz(Math.toDegrees(elevation), azimuth);
        };
    }

    private AbsoluteDate toDate(final Instant instant) {
        return new AbsoluteDate(Date.from(instant), utc);
    }

    private Vector3D positionOf(final CelestialTarget target, final AbsoluteDate date) {
        if (target instanceof FixedStar star) {
            final var direction = new Vector3D(Math.toRadians(star.raHours() * 15.0), Math.toRadians(star.decDegrees()));
            return direction.scalarMultiply(STAR_DISTANCE);
        }
        final var name = ((EphemerisBody) target).name();
        final var body = bodies.get(name);
        if (body == null) {
            throw new IllegalArgumentException("Body not in ephemeris: " + name);
        }
        return body.getPVCoordinates(date, inertial).getPosition();
    }
}
