package com.ai.booking.service;

import com.ai.booking.conversation.ConversationIntent;
import com.ai.booking.conversation.ExtractedFields;

import java.util.List;

/**
 * Best-effort reading of a user utterance. Implementations never throw: when they cannot
 * tell, they return {@link ConversationIntent#RAG} or {@link ExtractedFields#none()}.
 */
public interface LanguageUnderstandingClient {

    ConversationIntent classifyIntent(String utterance, List<String> recentTurns);

    ExtractedFields extractFields(String utterance, List<String> recentTurns);
}
