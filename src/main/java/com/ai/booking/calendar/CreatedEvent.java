package com.ai.booking.calendar;

public record CreatedEvent(String eventId, String link, String status) {
}
