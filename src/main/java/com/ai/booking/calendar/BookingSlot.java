package com.ai.booking.calendar;

import java.time.Duration;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * A bookable, fixed-duration range. Slots are advisory: they reflect the calendar at the
 * time of the query that produced them and are re-checked before any event is created.
 */
public record BookingSlot(ZonedDateTime start, ZonedDateTime end, ZoneId zone) {

    public BookingSlot {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        Objects.requireNonNull(zone, "zone");
        start = start.withZoneSameInstant(zone);
        end = end.withZoneSameInstant(zone);
        if (!start.isBefore(end)) {
            throw new IllegalArgumentException("Slot start must be before end: " + start + " / " + end);
        }
    }

    public Duration duration() {
        return Duration.between(start, end);
    }

    /** Strict overlap; touching ranges do not overlap. */
    public boolean overlaps(BusyInterval busy) {
        return start.isBefore(busy.end()) && busy.start().isBefore(end);
    }

    public TimeWindow toWindow() {
        return new TimeWindow(start, end, zone);
    }
}
