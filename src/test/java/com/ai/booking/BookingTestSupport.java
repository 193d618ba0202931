package com.ai.booking;

import com.ai.booking.calendar.BookingSlot;
import com.ai.booking.calendar.BusyInterval;
import com.ai.booking.calendar.TimeWindow;
import com.ai.booking.config.BookingProperties;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Shared fixtures. Monday 2025-03-10 in Kyiv (UTC+2 at that date) is "today".
 */
public final class BookingTestSupport {

    public static final ZoneId KYIV = ZoneId.of("Europe/Kyiv");
    public static final LocalDate TODAY = LocalDate.of(2025, 3, 10);

    private BookingTestSupport() {
    }

    public static Clock clockAt(int hour, int minute) {
        return Clock.fixed(TODAY.atTime(hour, minute).atZone(KYIV).toInstant(), KYIV);
    }

    public static BookingProperties properties() {
        BookingProperties properties = new BookingProperties();
        properties.setTimezone(KYIV.getId());
        properties.getRetry().setMaxAttempts(2);
        properties.getRetry().setBackoff(Duration.ofMillis(1));
        return properties;
    }

    public static ZonedDateTime at(LocalDate date, int hour, int minute) {
        return date.atTime(LocalTime.of(hour, minute)).atZone(KYIV);
    }

    public static TimeWindow window(LocalDate date, int fromHour, int toHour) {
        return new TimeWindow(at(date, fromHour, 0), at(date, toHour, 0), KYIV);
    }

    public static BookingSlot slot(LocalDate date, int hour, int minute) {
        ZonedDateTime start = at(date, hour, minute);
        return new BookingSlot(start, start.plusMinutes(30), KYIV);
    }

    public static BusyInterval busy(LocalDate date, int fromHour, int fromMinute, int toHour, int toMinute) {
        return new BusyInterval(at(date, fromHour, fromMinute), at(date, toHour, toMinute));
    }
}
