package com.ai.booking.conversation;

/**
 * Result of YES/NO classification of a confirmation reply.
 */
public enum YesNoResult {
    YES,
    NO,
    UNKNOWN
}
