package com.ai.booking.calendar;

public class AvailabilityQueryException extends CalendarGatewayException {

    public AvailabilityQueryException(String message, FailureKind kind, Throwable cause) {
        super(message, kind, cause);
    }

    public AvailabilityQueryException(String message, FailureKind kind) {
        this(message, kind, null);
    }
}
