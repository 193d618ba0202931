package com.ai.booking.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Ledger row for every event the agent created. The token column makes a second row for
 * the same confirmed intent impossible.
 */
@Entity
@Table(name = "booking_record", uniqueConstraints = {
    @UniqueConstraint(name = "uk_booking_record_token", columnNames = {"idempotency_token"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BookingRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "idempotency_token", nullable = false, length = 64)
    private String idempotencyToken;

    @Column(name = "event_id", nullable = false)
    private String eventId;

    @Column(length = 1024)
    private String link;

    @Column(name = "attendee_name", nullable = false)
    private String attendeeName;

    @Column(name = "attendee_email", nullable = false)
    private String attendeeEmail;

    @Column(name = "slot_start", nullable = false)
    private Instant slotStart;

    @Column(name = "slot_end", nullable = false)
    private Instant slotEnd;

    @Column(nullable = false)
    private String timezone;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
