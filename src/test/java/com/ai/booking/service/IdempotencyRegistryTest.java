package com.ai.booking.service;

import com.ai.booking.MutableClock;
import com.ai.booking.conversation.BookingRequest;
import com.ai.booking.conversation.BookingResult;
import com.ai.booking.conversation.UserInfo;
import com.ai.booking.entity.BookingRecord;
import com.ai.booking.repository.BookingRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Duration;
import java.util.Optional;

import static com.ai.booking.BookingTestSupport.KYIV;
import static com.ai.booking.BookingTestSupport.TODAY;
import static com.ai.booking.BookingTestSupport.slot;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class IdempotencyRegistryTest {

    private static final BookingResult CONFIRMED = BookingResult.confirmed("evt1", "https://calendar.example/evt1");

    private BookingRecordRepository repository;
    private MutableClock clock;
    private IdempotencyRegistry registry;

    @BeforeEach
    void setUp() {
        repository = Mockito.mock(BookingRecordRepository.class);
        when(repository.findByIdempotencyToken(anyString())).thenReturn(Optional.empty());
        clock = new MutableClock(TODAY.atTime(9, 0).atZone(KYIV).toInstant());
        registry = new IdempotencyRegistry(repository, clock);
    }

    @Test
    void rememberedResultExpiresAfterTtl() {
        registry.remember("tok-a", CONFIRMED);

        clock.advance(Duration.ofMinutes(29));
        assertThat(registry.find("tok-a")).contains(CONFIRMED);

        clock.advance(Duration.ofMinutes(2));
        assertThat(registry.find("tok-a")).isEmpty();
        assertThat(registry.size()).isZero();
    }

    @Test
    void expiredEntriesAreEvictedOnWrite() {
        for (int i = 0; i < 100; i++) {
            registry.remember("tok-" + i, CONFIRMED);
        }
        assertThat(registry.size()).isEqualTo(100);

        clock.advance(IdempotencyRegistry.TTL.plusMinutes(1));
        registry.remember("tok-new", CONFIRMED);

        assertThat(registry.size()).isEqualTo(1);
        assertThat(registry.find("tok-new")).contains(CONFIRMED);
    }

    @Test
    void onlyConfirmedResultsAreKept() {
        assertThatThrownBy(() -> registry.remember("tok-a", BookingResult.retryable("503")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(registry.find("tok-a")).isEmpty();
    }

    @Test
    void recordUpdatesExistingLedgerRow() {
        BookingRequest request = BookingRequest.confirmed(
                new UserInfo("Olena", "olena@example.com", "today"), slot(TODAY, 10, 0));
        BookingRecord existing = BookingRecord.builder()
                .idempotencyToken(request.idempotencyToken())
                .eventId("evt-old")
                .build();
        when(repository.findByIdempotencyToken(request.idempotencyToken())).thenReturn(Optional.of(existing));

        registry.record(request, CONFIRMED);

        verify(repository).save(existing);
        assertThat(existing.getEventId()).isEqualTo("evt1");
        assertThat(existing.getAttendeeEmail()).isEqualTo("olena@example.com");
        assertThat(registry.find(request.idempotencyToken())).contains(CONFIRMED);
    }

    @Test
    void ledgerEntryIsNotTrustedAsRecent() {
        BookingRecord row = BookingRecord.builder().idempotencyToken("tok-a").eventId("evt-old").link("l").build();
        when(repository.findByIdempotencyToken("tok-a")).thenReturn(Optional.of(row));

        assertThat(registry.find("tok-a")).isEmpty();
        assertThat(registry.findRecorded("tok-a")).contains(BookingResult.confirmed("evt-old", "l"));
        verify(repository, never()).save(any());
    }
}
