package io.github.jakubt4.skychart.sky;

import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.ZoneId;

/**
 * A local date-time that does not map to exactly one instant in the observer's
 * zone: it falls into a DST gap or is repeated by a DST fold.
 */
public class LocalizationException extends DateTimeException {

    public LocalizationException(final LocalDateTime when, final ZoneId zone, final boolean gap) {
        super("Cannot localize " + when + " in " + zone + ": "
                + (gap ? "time does not exist (DST gap)" : "time is ambiguous (DST overlap)"));
    }
}
