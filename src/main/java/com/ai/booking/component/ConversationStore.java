package com.ai.booking.component;

import com.ai.booking.entity.ConversationMessage;
import com.ai.booking.repository.ConversationMessageRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Transcript of each session: kept in memory for prompting and written to
 * {@code conversation_message} for later review.
 */
@Component
public class ConversationStore {

    private static final Logger log = LoggerFactory.getLogger(ConversationStore.class);
    private static final int SUMMARY_TURNS = 6;

    private final Map<String, List<ChatMessage>> conversations = new ConcurrentHashMap<>();
    private final ConversationMessageRepository repository;

    public ConversationStore(ConversationMessageRepository repository) {
        this.repository = repository;
    }

    public List<ChatMessage> getHistory(String sessionId) {
        List<ChatMessage> history = conversations.get(sessionId);
        if (history == null) return Collections.emptyList();
        synchronized (history) {
            return List.copyOf(history);
        }
    }

    public void appendUser(String sessionId, String text) {
        append(sessionId, "user", text);
        log.info("[{}] User: {}", sessionId, text);
    }

    public void appendAssistant(String sessionId, String text) {
        append(sessionId, "assistant", text);
        log.info("[{}] Assistant: {}", sessionId, text);
    }

    private void append(String sessionId, String role, String text) {
        String content = StringUtils.abbreviate(StringUtils.defaultString(text), 4000);
        List<ChatMessage> history = conversations.computeIfAbsent(sessionId, key -> new ArrayList<>());
        synchronized (history) {
            history.add(new ChatMessage(role, content));
        }
        try {
            repository.save(ConversationMessage.builder()
                    .sessionId(sessionId)
                    .role(role)
                    .content(content)
                    .build());
        } catch (DataAccessException e) {
            log.warn("[{}] Failed to persist conversation message", sessionId, e);
        }
    }

    /** Drops the in-memory transcript; the persisted one is kept. */
    public void clear(String sessionId) {
        conversations.remove(sessionId);
    }

    public List<String> getConversationSummary(String sessionId) {
        List<ChatMessage> history = getHistory(sessionId);
        if (history.isEmpty()) {
            return Collections.emptyList();
        }
        List<String> summary = new ArrayList<>();
        int start = Math.max(0, history.size() - SUMMARY_TURNS);
        for (int i = start; i < history.size(); i++) {
            ChatMessage m = history.get(i);
            summary.add(m.role() + ": " + m.content());
        }
        return summary;
    }
}
