package io.github.jakubt4.skychart.render;

import java.text.FieldPosition;
import java.text.NumberFormat;
import java.text.ParsePosition;

/**
 * Labels the radial axis, which is a zenith angle, with the matching altitude in degrees.
 */
class AltitudeFormat extends NumberFormat {

    private static final char DEGREE = '°';

    @Override
    public StringBuffer format(final double zenithAngle, final StringBuffer toAppendTo, final FieldPosition pos) {
        return toAppendTo.append(Math.round(90.0 - zenithAngle)).append(DEGREE);
    }

    @Override
    public StringBuffer format(final long zenithAngle, final StringBuffer toAppendTo, final FieldPosition pos) {
        return format((double) zenithAngle, toAppendTo, pos);
    }

    @Override
    public Number parse(final String source, final ParsePosition parsePosition) {
        return null;
    }
}
