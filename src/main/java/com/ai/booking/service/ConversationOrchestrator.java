package com.ai.booking.service;

import com.ai.booking.component.ConversationStore;
import com.ai.booking.config.BookingProperties;
import com.ai.booking.conversation.BookingStage;
import com.ai.booking.conversation.ConversationIntent;
import com.ai.booking.conversation.ConversationState;
import com.ai.booking.conversation.ExtractedFields;
import com.ai.booking.conversation.TurnResult;
import com.ai.booking.conversation.UserInfo;
import com.ai.booking.conversation.UserTurn;
import com.ai.booking.dto.FlowResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single entry for a chat session: routes each message either to question answering or to the
 * booking state machine, and owns the per-session {@link ConversationState}.
 * Booking decisions are never taken by the language model; it only classifies and extracts.
 */
@Service
public class ConversationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ConversationOrchestrator.class);

    static final String MDC_SESSION = "sessionId";

    private final BookingFlowService bookingFlowService;
    private final LanguageUnderstandingClient languageUnderstandingClient;
    private final QuestionAnsweringService questionAnsweringService;
    private final ResponseRenderer responseRenderer;
    private final ConversationStore conversationStore;
    private final BookingProperties properties;
    private final Clock clock;

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();

    public ConversationOrchestrator(BookingFlowService bookingFlowService,
                                    LanguageUnderstandingClient languageUnderstandingClient,
                                    QuestionAnsweringService questionAnsweringService,
                                    ResponseRenderer responseRenderer,
                                    ConversationStore conversationStore,
                                    BookingProperties properties,
                                    Clock clock) {
        this.bookingFlowService = bookingFlowService;
        this.languageUnderstandingClient = languageUnderstandingClient;
        this.questionAnsweringService = questionAnsweringService;
        this.responseRenderer = responseRenderer;
        this.conversationStore = conversationStore;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Process one user message. Messages of the same session are handled one at a time.
     */
    public ChatReply process(String sessionId, String utterance) {
        MDC.put(MDC_SESSION, sessionId);
        try {
            while (true) {
                Session session = sessions.computeIfAbsent(sessionId, id -> new Session(clock.instant()));
                synchronized (session) {
                    if (session.closed) {
                        continue;
                    }
                    ChatReply reply = handle(sessionId, session, utterance);
                    conversationStore.appendAssistant(sessionId, reply.reply());
                    return reply;
                }
            }
        } finally {
            MDC.remove(MDC_SESSION);
        }
    }

    private ChatReply handle(String sessionId, Session session, String utterance) {
        Instant now = clock.instant();
        if (isExpired(session, now) && !session.state.isTerminal()) {
            log.info("[{}] Session idle since {}, previous flow abandoned at {}",
                    sessionId, session.lastActivity, session.state.getStage());
            session.state = ConversationState.initial();
        }
        session.lastActivity = now;

        // context is the prior turns only; the utterance is passed on its own
        List<String> context = conversationStore.getConversationSummary(sessionId);
        conversationStore.appendUser(sessionId, utterance);

        ConversationState state = session.state;
        if (!isFlowActive(state)) {
            ConversationIntent intent = languageUnderstandingClient.classifyIntent(utterance, context);
            if (intent == ConversationIntent.RAG) {
                String answer = questionAnsweringService.answer(sessionId, conversationStore.getHistory(sessionId));
                logFlow(sessionId, FlowResponse.Type.ANSWER.name(), "rag");
                return new ChatReply(responseRenderer.toText(FlowResponse.answer(answer)), state);
            }
        }

        ExtractedFields fields = languageUnderstandingClient.extractFields(utterance, context);
        TurnResult result = bookingFlowService.advance(state, new UserTurn(utterance, fields));
        session.state = result.state();
        logFlow(sessionId, result.response().getType().name(), "flow");
        return new ChatReply(responseRenderer.toText(result.response()), result.state());
    }

    /**
     * A flow is active once it has collected anything or moved past qualification.
     */
    private static boolean isFlowActive(ConversationState state) {
        return state.getStage() != BookingStage.QUALIFYING || !state.getUserInfo().equals(UserInfo.empty());
    }

    public Optional<ConversationState> getState(String sessionId) {
        Session session = sessions.get(sessionId);
        if (session == null) return Optional.empty();
        synchronized (session) {
            return session.closed ? Optional.empty() : Optional.of(session.state);
        }
    }

    /**
     * Abandon and forget the session. Returns false when there was nothing to end.
     */
    public boolean endSession(String sessionId) {
        Session session = sessions.remove(sessionId);
        conversationStore.clear(sessionId);
        if (session == null) return false;
        synchronized (session) {
            session.closed = true;
            if (!session.state.isTerminal()) {
                log.info("[{}] Session ended by client at {}", sessionId, session.state.getStage());
            }
        }
        return true;
    }

    /**
     * Forget sessions idle for longer than the session timeout.
     *
     * @return number of sessions removed
     */
    public int evictIdleSessions() {
        Instant now = clock.instant();
        int removed = 0;
        for (Map.Entry<String, Session> entry : sessions.entrySet()) {
            Session session = entry.getValue();
            synchronized (session) {
                if (!session.closed && isExpired(session, now) && sessions.remove(entry.getKey(), session)) {
                    session.closed = true;
                    conversationStore.clear(entry.getKey());
                    removed++;
                    if (!session.state.isTerminal()) {
                        log.info("[{}] Idle session abandoned at {}", entry.getKey(), session.state.getStage());
                    }
                }
            }
        }
        return removed;
    }

    int activeSessions() {
        return sessions.size();
    }

    private boolean isExpired(Session session, Instant now) {
        Duration timeout = properties.getSessionTimeout();
        return session.lastActivity.plus(timeout).isBefore(now);
    }

    private void logFlow(String sessionId, String outcome, String source) {
        log.debug("[{}] flow outcome={} source={}", sessionId, outcome, source);
    }

    private static final class Session {
        private ConversationState state = ConversationState.initial();
        private Instant lastActivity;
        private boolean closed;

        private Session(Instant createdAt) {
            this.lastActivity = createdAt;
        }
    }

    public record ChatReply(String reply, ConversationState state) {

        public boolean isTerminal() {
            return state.isTerminal();
        }
    }
}
