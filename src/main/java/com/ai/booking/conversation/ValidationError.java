package com.ai.booking.conversation;

/**
 * A supplied qualification value that was rejected. Handled by re-asking for the same field.
 */
public record ValidationError(QualificationField field, String rejectedValue) {
}
