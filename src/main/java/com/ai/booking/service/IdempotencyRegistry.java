package com.ai.booking.service;

import com.ai.booking.conversation.BookingRequest;
import com.ai.booking.conversation.BookingResult;
import com.ai.booking.entity.BookingRecord;
import com.ai.booking.repository.BookingRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Confirmed booking results keyed by idempotency token. Recent results are held in memory for
 * {@link #TTL}; older ones live only in the booking ledger and are returned by
 * {@link #findRecorded} for the caller to check against the calendar.
 */
@Component
public class IdempotencyRegistry {

    private static final Logger log = LoggerFactory.getLogger(IdempotencyRegistry.class);

    static final Duration TTL = Duration.ofMinutes(30);

    private final Map<String, CachedResult> recent = new ConcurrentHashMap<>();
    private final BookingRecordRepository repository;
    private final Clock clock;

    public IdempotencyRegistry(BookingRecordRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    /** A result confirmed by this instance within the last {@link #TTL}. */
    public Optional<BookingResult> find(String token) {
        CachedResult cached = recent.get(token);
        if (cached == null) {
            return Optional.empty();
        }
        if (cached.expiresAt().isBefore(clock.instant())) {
            recent.remove(token, cached);
            return Optional.empty();
        }
        return Optional.of(cached.result());
    }

    /** The ledger entry for {@code token}; the event behind it may have been cancelled since. */
    public Optional<BookingResult> findRecorded(String token) {
        try {
            return repository.findByIdempotencyToken(token)
                    .map(r -> BookingResult.confirmed(r.getEventId(), r.getLink()));
        } catch (DataAccessException e) {
            log.warn("Ledger lookup failed, continuing without it", e);
            return Optional.empty();
        }
    }

    /** Keep a result that was checked against the calendar, without touching the ledger. */
    public void remember(String token, BookingResult result) {
        requireConfirmed(result);
        evictExpired();
        recent.put(token, new CachedResult(result, clock.instant().plus(TTL)));
    }

    /**
     * Remember a confirmed result and write it to the ledger, replacing an earlier row for the
     * same token. The in-memory entry is kept even when the ledger write fails.
     */
    public void record(BookingRequest request, BookingResult result) {
        remember(request.idempotencyToken(), result);
        try {
            BookingRecord record = repository.findByIdempotencyToken(request.idempotencyToken())
                    .orElseGet(() -> BookingRecord.builder().idempotencyToken(request.idempotencyToken()).build());
            record.setEventId(result.eventId());
            record.setLink(result.link());
            record.setAttendeeName(request.user().name());
            record.setAttendeeEmail(request.user().email());
            record.setSlotStart(request.slot().start().toInstant());
            record.setSlotEnd(request.slot().end().toInstant());
            record.setTimezone(request.slot().zone().getId());
            repository.save(record);
        } catch (DataIntegrityViolationException e) {
            log.info("Booking {} already in ledger", result.eventId());
        } catch (DataAccessException e) {
            log.error("Failed to write booking {} to ledger", result.eventId(), e);
        }
    }

    int size() {
        return recent.size();
    }

    private void evictExpired() {
        Instant now = clock.instant();
        recent.entrySet().removeIf(entry -> entry.getValue().expiresAt().isBefore(now));
    }

    private static void requireConfirmed(BookingResult result) {
        if (!result.isConfirmed()) {
            throw new IllegalArgumentException("Only confirmed results are recorded, got " + result.status());
        }
    }

    private record CachedResult(BookingResult result, Instant expiresAt) {
    }
}
