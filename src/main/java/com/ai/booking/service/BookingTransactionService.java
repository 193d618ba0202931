package com.ai.booking.service;

import com.ai.booking.calendar.AvailabilityQueryException;
import com.ai.booking.calendar.BookingApiException;
import com.ai.booking.calendar.BookingSlot;
import com.ai.booking.calendar.BusyInterval;
import com.ai.booking.calendar.CalendarGateway;
import com.ai.booking.calendar.CalendarGatewayException;
import com.ai.booking.calendar.CreatedEvent;
import com.ai.booking.conversation.BookingRequest;
import com.ai.booking.conversation.BookingResult;
import io.github.resilience4j.retry.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * The commit step of a booking: re-check the slot against fresh free/busy data, create the
 * event, classify the outcome. At most one event is created per idempotency token.
 */
@Service
public class BookingTransactionService {

    private static final Logger log = LoggerFactory.getLogger(BookingTransactionService.class);

    private final CalendarGateway calendarGateway;
    private final AvailabilityService availabilityService;
    private final SlotService slotService;
    private final IdempotencyRegistry idempotencyRegistry;
    private final Retry calendarRetry;

    private static final int LOCK_STRIPES = 64;

    /** Commits whose tokens hash to the same stripe run one at a time. */
    private final Object[] tokenLocks = new Object[LOCK_STRIPES];

    public BookingTransactionService(CalendarGateway calendarGateway, AvailabilityService availabilityService,
                                     SlotService slotService, IdempotencyRegistry idempotencyRegistry,
                                     Retry calendarRetry) {
        this.calendarGateway = calendarGateway;
        this.availabilityService = availabilityService;
        this.slotService = slotService;
        this.idempotencyRegistry = idempotencyRegistry;
        this.calendarRetry = calendarRetry;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            tokenLocks[i] = new Object();
        }
    }

    public BookingResult commit(BookingRequest request) {
        String token = request.idempotencyToken();
        synchronized (tokenLocks[Math.floorMod(token.hashCode(), LOCK_STRIPES)]) {
            Optional<BookingResult> previous = idempotencyRegistry.find(token);
            if (previous.isPresent()) {
                log.info("Commit repeated for token {}, returning event {}", shortToken(token), previous.get().eventId());
                return previous.get();
            }
            if (idempotencyRegistry.findRecorded(token).isPresent()) {
                Optional<BookingResult> live;
                try {
                    live = calendarGateway.findEvent(token)
                            .map(event -> BookingResult.confirmed(event.eventId(), event.link()));
                } catch (BookingApiException e) {
                    return classify(e, "ledger check");
                }
                if (live.isPresent()) {
                    log.info("Token {} already booked as event {}", shortToken(token), live.get().eventId());
                    idempotencyRegistry.remember(token, live.get());
                    return live.get();
                }
                log.info("Ledger entry for token {} has no live event, booking again", shortToken(token));
            }
            BookingResult result = execute(request);
            if (result.isConfirmed()) {
                idempotencyRegistry.record(request, result);
            }
            return result;
        }
    }

    private BookingResult execute(BookingRequest request) {
        BookingSlot slot = request.slot();
        String token = request.idempotencyToken();

        List<BusyInterval> busy;
        try {
            busy = availabilityService.queryBusy(slot.toWindow());
        } catch (AvailabilityQueryException e) {
            return classify(e, "availability re-check");
        }

        if (!slotService.isFree(slot, busy)) {
            try {
                Optional<CreatedEvent> own = calendarGateway.findEvent(token);
                if (own.isPresent()) {
                    log.info("Slot {} is held by our own event {} from an earlier attempt", slot.start(), own.get().eventId());
                    return BookingResult.confirmed(own.get().eventId(), own.get().link());
                }
            } catch (BookingApiException e) {
                log.warn("Could not look up event for token {}: {}", shortToken(token), e.getMessage());
            }
            log.info("Slot {} - {} taken since it was proposed", slot.start(), slot.end());
            return BookingResult.slotConflict();
        }

        String summary = "Meeting with " + request.user().name();
        CreatedEvent event;
        try {
            event = Retry.decorateSupplier(calendarRetry,
                    () -> calendarGateway.createEvent(slot, summary, request.user().email(), token)).get();
        } catch (BookingApiException e) {
            return classify(e, "event creation");
        }

        log.info("Booked {} for {} at {} (event {})", summary, request.user().email(), slot.start(), event.eventId());
        return BookingResult.confirmed(event.eventId(), event.link());
    }

    private BookingResult classify(CalendarGatewayException e, String step) {
        switch (e.getKind()) {
            case TRANSIENT:
                log.warn("Booking {} failed transiently after retries: {}", step, e.getMessage());
                return BookingResult.retryable(e.getMessage());
            case AUTH:
                log.error("Calendar credentials rejected during {}; bookings are blocked until they are fixed", step, e);
                return BookingResult.fatal(BookingResult.ErrorKind.AUTH, e.getMessage());
            case REJECTED:
            default:
                log.error("Calendar rejected {}: {}", step, e.getMessage());
                return BookingResult.fatal(BookingResult.ErrorKind.REJECTED, e.getMessage());
        }
    }

    private static String shortToken(String token) {
        return token.length() > 12 ? token.substring(0, 12) : token;
    }
}
