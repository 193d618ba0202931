package com.ai.booking.calendar;

public abstract class CalendarGatewayException extends RuntimeException {

    private final FailureKind kind;

    protected CalendarGatewayException(String message, FailureKind kind, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind getKind() {
        return kind;
    }

    public boolean isTransient() {
        return kind == FailureKind.TRANSIENT;
    }
}
