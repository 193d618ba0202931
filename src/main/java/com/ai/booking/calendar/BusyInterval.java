package com.ai.booking.calendar;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * A range the calendar reports as occupied.
 */
public record BusyInterval(ZonedDateTime start, ZonedDateTime end) {

    public BusyInterval {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (!start.isBefore(end)) {
            throw new IllegalArgumentException("Busy interval start must be before end: " + start + " / " + end);
        }
    }

    public BusyInterval inZone(ZoneId zone) {
        return new BusyInterval(start.withZoneSameInstant(zone), end.withZoneSameInstant(zone));
    }
}
