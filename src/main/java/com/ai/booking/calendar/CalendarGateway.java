package com.ai.booking.calendar;

import java.util.List;
import java.util.Optional;

/**
 * Remote calendar as seen by the booking engine. Every call may block on the network
 * and may fail; implementations classify failures through {@link FailureKind}.
 */
public interface CalendarGateway {

    /**
     * Busy ranges overlapping {@code window}, in no particular order.
     *
     * @throws AvailabilityQueryException when the free/busy query fails
     */
    List<BusyInterval> queryBusy(TimeWindow window);

    /**
     * Create an event for {@code slot} with {@code attendeeEmail} as the only attendee and
     * attendee notifications enabled. {@code requestId} is stable for one booking intent;
     * implementations use it so that a repeated call after a lost response does not
     * produce a second event.
     *
     * @throws BookingApiException when the event cannot be created
     */
    CreatedEvent createEvent(BookingSlot slot, String organizerSummary, String attendeeEmail, String requestId);

    /**
     * Look up the event created for {@code requestId}, if any. Used to tell our own earlier
     * event apart from a competing booking.
     *
     * @throws BookingApiException when the lookup fails
     */
    Optional<CreatedEvent> findEvent(String requestId);
}
