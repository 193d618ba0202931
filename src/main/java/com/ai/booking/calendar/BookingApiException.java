package com.ai.booking.calendar;

public class BookingApiException extends CalendarGatewayException {

    public BookingApiException(String message, FailureKind kind, Throwable cause) {
        super(message, kind, cause);
    }

    public BookingApiException(String message, FailureKind kind) {
        this(message, kind, null);
    }
}
