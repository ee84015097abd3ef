package io.github.jakubt4.skychart.scene;

/**
 * Direction seen by a ground observer, in chart coordinates.
 *
 * @param azimuth     radians from north through east; {@code [0, 2π)} as computed,
 *                    up to {@code 4π} after wraparound correction
 * @param zenithAngle degrees from the zenith: 0 overhead, 90 on the horizon,
 *                    above 90 below the horizon
 */
public record HorizontalCoordinate(double azimuth, double zenithAngle) {

    public static final double HORIZON = 90.0;

    public boolean belowHorizon() {
        return zenithAngle > HORIZON;
    }
}
