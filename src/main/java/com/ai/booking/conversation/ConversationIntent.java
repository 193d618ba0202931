package com.ai.booking.conversation;

/**
 * Top-level routing of an utterance: knowledge-base question or booking.
 */
public enum ConversationIntent {
    RAG,
    BOOKING
}
