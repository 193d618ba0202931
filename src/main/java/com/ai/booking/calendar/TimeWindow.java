package com.ai.booking.calendar;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Half-open search range [start, end) expressed in a declared zone.
 * Both bounds are normalized to {@code zone} on construction.
 */
public record TimeWindow(ZonedDateTime start, ZonedDateTime end, ZoneId zone) {

    public TimeWindow {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        Objects.requireNonNull(zone, "zone");
        start = start.withZoneSameInstant(zone);
        end = end.withZoneSameInstant(zone);
        if (!start.isBefore(end)) {
            throw new IllegalArgumentException("Window start must be before end: " + start + " / " + end);
        }
    }

    public static TimeWindow of(ZonedDateTime start, ZonedDateTime end) {
        return new TimeWindow(start, end, start.getZone());
    }

    public TimeWindow shiftDays(int days) {
        return new TimeWindow(start.plusDays(days), end.plusDays(days), zone);
    }
}
