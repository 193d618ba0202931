package com.ai.booking.service;

import com.ai.booking.calendar.TimeWindow;
import com.ai.booking.config.BookingProperties;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a free-text time preference ("tomorrow afternoon", "friday", "2025-03-14 at 3pm")
 * into a concrete search window in the booking timezone.
 */
@Service
public class TimePreferenceResolver {

    private static final Logger log = LoggerFactory.getLogger(TimePreferenceResolver.class);

    private static final Pattern ISO_DATE = Pattern.compile("\\b(\\d{4}-\\d{2}-\\d{2})\\b");
    private static final Pattern CLOCK_12H = Pattern.compile("\\b(\\d{1,2})(?::(\\d{2}))?\\s*(am|pm|a\\.m\\.|p\\.m\\.)(?![a-z])",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern CLOCK_24H = Pattern.compile("\\b([01]?\\d|2[0-3]):([0-5]\\d)\\b");

    private static final Map<String, DayOfWeek> WEEKDAYS = Map.of(
            "monday", DayOfWeek.MONDAY,
            "tuesday", DayOfWeek.TUESDAY,
            "wednesday", DayOfWeek.WEDNESDAY,
            "thursday", DayOfWeek.THURSDAY,
            "friday", DayOfWeek.FRIDAY,
            "saturday", DayOfWeek.SATURDAY,
            "sunday", DayOfWeek.SUNDAY
    );

    private static final LocalTime MORNING_START = LocalTime.of(9, 0);
    private static final LocalTime MORNING_END = LocalTime.of(12, 0);
    private static final LocalTime AFTERNOON_START = LocalTime.of(14, 0);
    private static final LocalTime AFTERNOON_END = LocalTime.of(17, 0);
    private static final LocalTime EVENING_START = LocalTime.of(17, 0);
    private static final LocalTime EVENING_END = LocalTime.of(20, 0);
    private static final int EXPLICIT_TIME_SPAN_HOURS = 2;

    private final Clock clock;
    private final BookingProperties properties;

    public TimePreferenceResolver(Clock clock, BookingProperties properties) {
        this.clock = clock;
        this.properties = properties;
    }

    /**
     * Resolve {@code preference} or return empty when it names neither a day nor a time of day.
     * Dates in the past are not resolvable; a window for today that is already over moves to
     * the next day, and one that has started is clipped to the next slot boundary.
     */
    public Optional<TimeWindow> resolve(String preference) {
        if (StringUtils.isBlank(preference)) return Optional.empty();
        String text = preference.toLowerCase(Locale.ROOT).trim();
        ZoneId zone = properties.getZoneId();
        ZonedDateTime now = ZonedDateTime.now(clock).withZoneSameInstant(zone);
        LocalDate today = now.toLocalDate();

        Optional<LocalDate> explicitDate = parseDate(text, today);
        if (explicitDate.isPresent() && explicitDate.get().isBefore(today)) {
            log.debug("Preference '{}' resolves to a past date", preference);
            return Optional.empty();
        }
        Optional<LocalTime[]> range = parseTimeRange(text);
        if (explicitDate.isEmpty() && range.isEmpty()) {
            return Optional.empty();
        }

        LocalDate date = explicitDate.orElse(today);
        LocalTime[] hours = range.orElse(new LocalTime[]{
                LocalTime.of(properties.getWorkdayStartHour(), 0), workdayEnd()});

        ZonedDateTime start = date.atTime(hours[0]).atZone(zone);
        ZonedDateTime end = date.atTime(hours[1]).atZone(zone);
        if (hours[1].equals(LocalTime.MIDNIGHT)) {
            end = date.plusDays(1).atStartOfDay(zone);
        }
        if (!end.isAfter(now)) {
            if (explicitDate.isPresent() && !date.equals(today)) return Optional.empty();
            start = start.plusDays(1);
            end = end.plusDays(1);
        }
        if (start.isBefore(now)) {
            start = roundUpToSlot(now);
        }
        if (!start.isBefore(end)) {
            start = start.plusDays(1).with(hours[0]);
            end = end.plusDays(1);
        }
        TimeWindow window = new TimeWindow(start, end, zone);
        log.debug("Preference '{}' -> [{} - {}]", preference, window.start(), window.end());
        return Optional.of(window);
    }

    public boolean isResolvable(String preference) {
        return resolve(preference).isPresent();
    }

    /**
     * Start of the part of day the preference asks for, ignoring the current time. Following
     * days of a widened search begin here.
     */
    public LocalTime preferredStart(String preference) {
        LocalTime workdayStart = LocalTime.of(properties.getWorkdayStartHour(), 0);
        if (StringUtils.isBlank(preference)) return workdayStart;
        return parseTimeRange(preference.toLowerCase(Locale.ROOT).trim())
                .map(range -> range[0])
                .orElse(workdayStart);
    }

    /**
     * The calendar day named in {@code text} ("tomorrow", "friday", an ISO date), if any.
     */
    public Optional<LocalDate> mentionedDate(String text) {
        if (StringUtils.isBlank(text)) return Optional.empty();
        LocalDate today = ZonedDateTime.now(clock).withZoneSameInstant(properties.getZoneId()).toLocalDate();
        return parseDate(text.toLowerCase(Locale.ROOT).trim(), today);
    }

    private Optional<LocalDate> parseDate(String text, LocalDate today) {
        Matcher iso = ISO_DATE.matcher(text);
        if (iso.find()) {
            try {
                return Optional.of(LocalDate.parse(iso.group(1)));
            } catch (DateTimeParseException e) {
                return Optional.empty();
            }
        }
        if (text.contains("day after tomorrow")) return Optional.of(today.plusDays(2));
        if (text.contains("tomorrow")) return Optional.of(today.plusDays(1));
        if (text.contains("today") || text.contains("tonight")) return Optional.of(today);
        if (text.contains("next week")) return Optional.of(today.plusDays(7));
        for (Map.Entry<String, DayOfWeek> day : WEEKDAYS.entrySet()) {
            if (text.contains(day.getKey())) {
                return Optional.of(today.with(TemporalAdjusters.next(day.getValue())));
            }
        }
        return Optional.empty();
    }

    private Optional<LocalTime[]> parseTimeRange(String text) {
        Optional<LocalTime> explicit = parseClockTime(text);
        if (explicit.isPresent()) {
            LocalTime start = explicit.get();
            LocalTime end = start.plusHours(EXPLICIT_TIME_SPAN_HOURS);
            if (end.isBefore(start)) end = LocalTime.MIDNIGHT;
            return Optional.of(new LocalTime[]{start, end});
        }
        if (text.contains("morning")) return Optional.of(new LocalTime[]{MORNING_START, MORNING_END});
        if (text.contains("afternoon")) return Optional.of(new LocalTime[]{AFTERNOON_START, AFTERNOON_END});
        if (text.contains("evening") || text.contains("tonight")) return Optional.of(new LocalTime[]{EVENING_START, EVENING_END});
        return Optional.empty();
    }

    static Optional<LocalTime> parseClockTime(String text) {
        Matcher m12 = CLOCK_12H.matcher(text);
        if (m12.find()) {
            int hour = Integer.parseInt(m12.group(1));
            int minute = m12.group(2) != null ? Integer.parseInt(m12.group(2)) : 0;
            if (hour < 1 || hour > 12 || minute > 59) return Optional.empty();
            boolean pm = m12.group(3).toLowerCase(Locale.ROOT).startsWith("p");
            hour = hour % 12 + (pm ? 12 : 0);
            return Optional.of(LocalTime.of(hour, minute));
        }
        Matcher m24 = CLOCK_24H.matcher(text);
        if (m24.find()) {
            return Optional.of(LocalTime.of(Integer.parseInt(m24.group(1)), Integer.parseInt(m24.group(2))));
        }
        return Optional.empty();
    }

    private LocalTime workdayEnd() {
        int end = properties.getWorkdayEndHour();
        return end >= 24 ? LocalTime.MIDNIGHT : LocalTime.of(end, 0);
    }

    private ZonedDateTime roundUpToSlot(ZonedDateTime now) {
        int step = properties.getSlotDurationMinutes();
        ZonedDateTime truncated = now.truncatedTo(ChronoUnit.MINUTES);
        if (truncated.isBefore(now)) truncated = truncated.plusMinutes(1);
        ZonedDateTime dayStart = truncated.truncatedTo(ChronoUnit.DAYS);
        long minutes = ChronoUnit.MINUTES.between(dayStart, truncated);
        long rounded = ((minutes + step - 1) / step) * step;
        return dayStart.plusMinutes(rounded);
    }
}
