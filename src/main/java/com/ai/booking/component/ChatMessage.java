package com.ai.booking.component;

/**
 * One transcript line. Role is {@code user} or {@code assistant}, as the chat API expects.
 */
public record ChatMessage(String role, String content) {
}
