package com.ai.booking.calendar;

/**
 * Classification of a calendar API failure.
 */
public enum FailureKind {
    /** Timeouts, I/O errors, HTTP 5xx and 429. Safe to retry. */
    TRANSIENT,
    /** Credentials missing, expired or lacking permission. */
    AUTH,
    /** Request refused for any other reason (4xx). */
    REJECTED
}
