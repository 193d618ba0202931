package com.ai.booking.calendar;

import com.ai.booking.config.GoogleCalendarProperties;
import com.google.api.client.googleapis.json.GoogleJsonError;
import com.google.api.client.googleapis.json.GoogleJsonResponseException;
import com.google.api.client.http.HttpResponseException;
import com.google.api.client.util.DateTime;
import com.google.api.services.calendar.Calendar;
import com.google.api.services.calendar.model.Event;
import com.google.api.services.calendar.model.EventAttendee;
import com.google.api.services.calendar.model.EventDateTime;
import com.google.api.services.calendar.model.FreeBusyCalendar;
import com.google.api.services.calendar.model.FreeBusyRequest;
import com.google.api.services.calendar.model.FreeBusyRequestItem;
import com.google.api.services.calendar.model.FreeBusyResponse;
import com.google.api.services.calendar.model.TimePeriod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * {@link CalendarGateway} backed by the Google Calendar v3 API. The {@link Calendar} client is
 * built and authenticated by {@code CalendarConfig}; this class only issues requests and
 * classifies failures.
 */
@Component
public class GoogleCalendarGateway implements CalendarGateway {

    private static final Logger log = LoggerFactory.getLogger(GoogleCalendarGateway.class);

    private static final String EVENT_DESCRIPTION = "Booked via AI Agent";
    private static final String CANCELLED = "cancelled";
    private static final Set<String> RATE_LIMIT_REASONS = Set.of("rateLimitExceeded", "userRateLimitExceeded");

    private final Calendar calendar;
    private final String calendarId;

    public GoogleCalendarGateway(Calendar calendar, GoogleCalendarProperties properties) {
        this.calendar = calendar;
        this.calendarId = properties.getCalendarId();
    }

    @Override
    public List<BusyInterval> queryBusy(TimeWindow window) {
        FreeBusyRequest request = new FreeBusyRequest()
                .setTimeMin(toDateTime(window.start()))
                .setTimeMax(toDateTime(window.end()))
                .setTimeZone(window.zone().getId())
                .setItems(List.of(new FreeBusyRequestItem().setId(calendarId)));
        FreeBusyResponse response;
        try {
            response = calendar.freebusy().query(request).execute();
        } catch (IOException e) {
            FailureKind kind = classify(e);
            log.warn("Free/busy query failed for {} [{} - {}]: kind={} message={}",
                    calendarId, window.start(), window.end(), kind, e.getMessage());
            throw new AvailabilityQueryException("Failed to check availability: " + e.getMessage(), kind, e);
        }

        FreeBusyCalendar busyCalendar = response.getCalendars() != null ? response.getCalendars().get(calendarId) : null;
        if (busyCalendar == null) {
            throw new AvailabilityQueryException("Calendar " + calendarId + " missing from free/busy response",
                    FailureKind.REJECTED);
        }
        if (busyCalendar.getErrors() != null && !busyCalendar.getErrors().isEmpty()) {
            String reason = busyCalendar.getErrors().get(0).getReason();
            throw new AvailabilityQueryException("Free/busy error for " + calendarId + ": " + reason,
                    "notFound".equals(reason) ? FailureKind.REJECTED : FailureKind.AUTH);
        }

        List<BusyInterval> busy = new ArrayList<>();
        if (busyCalendar.getBusy() != null) {
            for (TimePeriod period : busyCalendar.getBusy()) {
                ZonedDateTime start = fromDateTime(period.getStart(), window.zone());
                ZonedDateTime end = fromDateTime(period.getEnd(), window.zone());
                if (start.isBefore(end)) {
                    busy.add(new BusyInterval(start, end));
                }
            }
        }
        log.debug("Free/busy for {} [{} - {}]: {} busy periods", calendarId, window.start(), window.end(), busy.size());
        return busy;
    }

    @Override
    public CreatedEvent createEvent(BookingSlot slot, String organizerSummary, String attendeeEmail, String requestId) {
        String zone = slot.zone().getId();
        Event event = new Event()
                .setId(requestId)
                .setSummary(organizerSummary)
                .setDescription(EVENT_DESCRIPTION)
                .setStart(new EventDateTime().setDateTime(toDateTime(slot.start())).setTimeZone(zone))
                .setEnd(new EventDateTime().setDateTime(toDateTime(slot.end())).setTimeZone(zone))
                .setAttendees(List.of(new EventAttendee().setEmail(attendeeEmail)));
        try {
            Event created = calendar.events().insert(calendarId, event).setSendUpdates("all").execute();
            log.info("Created event {} for {} at {}", created.getId(), attendeeEmail, slot.start());
            return new CreatedEvent(created.getId(), created.getHtmlLink(), created.getStatus());
        } catch (GoogleJsonResponseException e) {
            if (e.getStatusCode() == 409 && requestId != null) {
                return fetchExisting(event, e);
            }
            throw bookingFailure(e);
        } catch (IOException e) {
            throw bookingFailure(e);
        }
    }

    @Override
    public Optional<CreatedEvent> findEvent(String requestId) {
        try {
            Event existing = calendar.events().get(calendarId, requestId).execute();
            if (CANCELLED.equals(existing.getStatus())) {
                return Optional.empty();
            }
            return Optional.of(new CreatedEvent(existing.getId(), existing.getHtmlLink(), existing.getStatus()));
        } catch (GoogleJsonResponseException e) {
            if (e.getStatusCode() == 404 || e.getStatusCode() == 410) {
                return Optional.empty();
            }
            throw bookingFailure(e);
        } catch (IOException e) {
            throw bookingFailure(e);
        }
    }

    /**
     * An insert with an id that already exists means an earlier attempt went through, or the
     * event booked under this id was cancelled since. A cancelled event is restored with the
     * new details.
     */
    private CreatedEvent fetchExisting(Event requested, GoogleJsonResponseException conflict) {
        String eventId = requested.getId();
        try {
            Event existing = calendar.events().get(calendarId, eventId).execute();
            if (CANCELLED.equals(existing.getStatus())) {
                Event restored = calendar.events()
                        .update(calendarId, eventId, requested.clone().setStatus("confirmed"))
                        .setSendUpdates("all")
                        .execute();
                if (CANCELLED.equals(restored.getStatus())) {
                    throw new BookingApiException("Event " + eventId + " stays cancelled", FailureKind.REJECTED);
                }
                log.info("Event {} was cancelled, restored it", eventId);
                return new CreatedEvent(restored.getId(), restored.getHtmlLink(), restored.getStatus());
            }
            log.info("Event {} already exists, reusing it", eventId);
            return new CreatedEvent(existing.getId(), existing.getHtmlLink(), existing.getStatus());
        } catch (IOException e) {
            e.addSuppressed(conflict);
            throw bookingFailure(e);
        }
    }

    private BookingApiException bookingFailure(IOException e) {
        FailureKind kind = classify(e);
        log.warn("Event creation failed on {}: kind={} message={}", calendarId, kind, e.getMessage());
        return new BookingApiException("Failed to book meeting: " + e.getMessage(), kind, e);
    }

    static FailureKind classify(IOException e) {
        if (e instanceof HttpResponseException) {
            int status = ((HttpResponseException) e).getStatusCode();
            if (status == 429 || status >= 500) {
                return FailureKind.TRANSIENT;
            }
            if (status == 403 && isRateLimited(e)) {
                return FailureKind.TRANSIENT;
            }
            if (status == 401 || status == 403) {
                return FailureKind.AUTH;
            }
            return FailureKind.REJECTED;
        }
        HttpResponseException tokenError = tokenEndpointError(e);
        if (tokenError != null && Set.of(400, 401, 403).contains(tokenError.getStatusCode())) {
            return FailureKind.AUTH;
        }
        return FailureKind.TRANSIENT;
    }

    /**
     * A failed credential refresh reaches us as an {@link IOException} from the auth library
     * whose cause is the token endpoint's HTTP error.
     */
    private static HttpResponseException tokenEndpointError(IOException e) {
        for (Throwable cause = e.getCause(); cause != null && cause != e; cause = cause.getCause()) {
            if (cause instanceof HttpResponseException) {
                return (HttpResponseException) cause;
            }
        }
        return null;
    }

    private static boolean isRateLimited(IOException e) {
        if (!(e instanceof GoogleJsonResponseException)) {
            return false;
        }
        GoogleJsonError details = ((GoogleJsonResponseException) e).getDetails();
        if (details == null || details.getErrors() == null) {
            return false;
        }
        return details.getErrors().stream().anyMatch(err -> RATE_LIMIT_REASONS.contains(err.getReason()));
    }

    private static DateTime toDateTime(ZonedDateTime time) {
        return DateTime.parseRfc3339(time.toOffsetDateTime().format(DateTimeFormatter.ISO_OFFSET_DATE_TIME));
    }

    private static ZonedDateTime fromDateTime(DateTime time, ZoneId zone) {
        return Instant.ofEpochMilli(time.getValue()).atZone(zone);
    }
}
