package com.ai.booking.conversation;

/**
 * Outcome of one commit attempt. Only {@link Status#CONFIRMED} carries an event id,
 * and it is produced only from a successful event creation.
 */
public record BookingResult(Status status, String eventId, String link, ErrorKind error, String detail) {

    public enum Status {
        CONFIRMED,
        /** The slot was taken after it was proposed. */
        SLOT_CONFLICT,
        /** Transient calendar failure; the same request may be committed again. */
        RETRYABLE,
        /** Non-recoverable failure; the flow ends. */
        FATAL
    }

    public enum ErrorKind {
        TRANSIENT,
        AUTH,
        REJECTED
    }

    public static BookingResult confirmed(String eventId, String link) {
        return new BookingResult(Status.CONFIRMED, eventId, link, null, null);
    }

    public static BookingResult slotConflict() {
        return new BookingResult(Status.SLOT_CONFLICT, null, null, null, "slot no longer available");
    }

    public static BookingResult retryable(String detail) {
        return new BookingResult(Status.RETRYABLE, null, null, ErrorKind.TRANSIENT, detail);
    }

    public static BookingResult fatal(ErrorKind error, String detail) {
        return new BookingResult(Status.FATAL, null, null, error, detail);
    }

    public boolean isConfirmed() {
        return status == Status.CONFIRMED;
    }
}
