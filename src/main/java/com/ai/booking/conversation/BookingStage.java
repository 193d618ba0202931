package com.ai.booking.conversation;

/**
 * Stages of one booking flow. DONE, ABANDONED and FAILED are terminal.
 */
public enum BookingStage {
    QUALIFYING,
    PROPOSING,
    CONFIRMING,
    BOOKING,
    DONE,
    ABANDONED,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == ABANDONED || this == FAILED;
    }
}
