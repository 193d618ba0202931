package com.ai.booking.service;

import com.ai.booking.MutableClock;
import com.ai.booking.component.ConversationStore;
import com.ai.booking.component.ResponsePhrases;
import com.ai.booking.config.BookingProperties;
import com.ai.booking.conversation.BookingStage;
import com.ai.booking.conversation.ConversationIntent;
import com.ai.booking.conversation.ConversationState;
import com.ai.booking.conversation.ExtractedFields;
import com.ai.booking.conversation.QualificationField;
import com.ai.booking.conversation.TurnResult;
import com.ai.booking.conversation.UserInfo;
import com.ai.booking.conversation.UserTurn;
import com.ai.booking.dto.FlowResponse;
import com.ai.booking.repository.ConversationMessageRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

import java.time.Duration;
import java.util.List;

import static com.ai.booking.BookingTestSupport.KYIV;
import static com.ai.booking.BookingTestSupport.TODAY;
import static com.ai.booking.BookingTestSupport.properties;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ConversationOrchestratorTest {

    private static final String SESSION = "s-1";

    private final ResponsePhrases phrases = new ResponsePhrases();
    private BookingFlowService flow;
    private LanguageUnderstandingClient understanding;
    private QuestionAnsweringService questionAnswering;
    private ConversationStore store;
    private MutableClock clock;
    private ConversationOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        flow = Mockito.mock(BookingFlowService.class);
        understanding = Mockito.mock(LanguageUnderstandingClient.class);
        questionAnswering = Mockito.mock(QuestionAnsweringService.class);
        store = new ConversationStore(Mockito.mock(ConversationMessageRepository.class));
        clock = new MutableClock(TODAY.atTime(10, 0).atZone(KYIV).toInstant());
        BookingProperties props = properties();
        props.setSessionTimeout(Duration.ofMinutes(30));
        orchestrator = new ConversationOrchestrator(flow, understanding, questionAnswering,
                new ResponseRenderer(phrases), store, props, clock);

        when(understanding.extractFields(anyString(), anyList())).thenReturn(ExtractedFields.none());
    }

    private static ConversationState withName(String name) {
        return ConversationState.initial().toBuilder().userInfo(UserInfo.empty().withName(name)).build();
    }

    private void flowReplies(ConversationState next) {
        when(flow.advance(any(), any())).thenReturn(new TurnResult(
                FlowResponse.askFields(List.of(QualificationField.EMAIL, QualificationField.TIME_PREFERENCE), "Olena"), next));
    }

    @Test
    void questionOutsideFlowIsAnswered() {
        when(understanding.classifyIntent(anyString(), anyList())).thenReturn(ConversationIntent.RAG);
        when(questionAnswering.answer(eq(SESSION), anyList())).thenReturn("We are open 9 to 5.");

        ConversationOrchestrator.ChatReply reply = orchestrator.process(SESSION, "When are you open?");

        assertThat(reply.reply()).isEqualTo("We are open 9 to 5.");
        assertThat(reply.state()).isEqualTo(ConversationState.initial());
        verify(flow, never()).advance(any(), any());
        assertThat(store.getHistory(SESSION)).extracting(m -> m.role()).containsExactly("user", "assistant");
    }

    @Test
    void bookingIntentEntersFlow() {
        when(understanding.classifyIntent(anyString(), anyList())).thenReturn(ConversationIntent.BOOKING);
        flowReplies(withName("Olena"));

        ConversationOrchestrator.ChatReply reply = orchestrator.process(SESSION, "I'm Olena, I'd like to book a call");

        assertThat(reply.reply()).isEqualTo(phrases.askEmail("Olena"));
        assertThat(orchestrator.getState(SESSION)).contains(withName("Olena"));
        verify(questionAnswering, never()).answer(anyString(), anyList());
    }

    @Test
    void activeFlowSkipsIntentRouting() {
        when(understanding.classifyIntent(anyString(), anyList())).thenReturn(ConversationIntent.BOOKING);
        flowReplies(withName("Olena"));

        orchestrator.process(SESSION, "book a meeting, I'm Olena");
        orchestrator.process(SESSION, "what time zone are you in?");

        verify(understanding, times(1)).classifyIntent(anyString(), anyList());
        verify(flow, times(2)).advance(any(), any());
    }

    @Test
    void contextPassedToUnderstandingHoldsOnlyEarlierTurns() {
        when(understanding.classifyIntent(anyString(), anyList())).thenReturn(ConversationIntent.BOOKING);
        flowReplies(withName("Olena"));

        orchestrator.process(SESSION, "hello, I'd like a meeting");
        orchestrator.process(SESSION, "olena@example.com");

        verify(understanding).classifyIntent("hello, I'd like a meeting", List.of());
        verify(understanding).extractFields("hello, I'd like a meeting", List.of());
        verify(understanding).extractFields("olena@example.com", List.of(
                "user: hello, I'd like a meeting",
                "assistant: " + phrases.askEmail("Olena")));
        assertThat(store.getHistory(SESSION)).extracting(m -> m.content())
                .containsExactly("hello, I'd like a meeting", phrases.askEmail("Olena"), "olena@example.com",
                        phrases.askEmail("Olena"));
    }

    @Test
    void idleFlowStartsOver() {
        when(understanding.classifyIntent(anyString(), anyList())).thenReturn(ConversationIntent.BOOKING);
        flowReplies(withName("Olena"));
        orchestrator.process(SESSION, "book a meeting, I'm Olena");

        clock.advance(Duration.ofMinutes(31));
        orchestrator.process(SESSION, "book a meeting");

        ArgumentCaptor<ConversationState> states = ArgumentCaptor.forClass(ConversationState.class);
        verify(flow, times(2)).advance(states.capture(), any(UserTurn.class));
        assertThat(states.getAllValues().get(1)).isEqualTo(ConversationState.initial());
    }

    @Test
    void finishedSessionKeepsItsOutcome() {
        ConversationState done = ConversationState.initial().moveTo(BookingStage.ABANDONED);
        when(understanding.classifyIntent(anyString(), anyList())).thenReturn(ConversationIntent.BOOKING);
        when(flow.advance(any(), any())).thenReturn(new TurnResult(FlowResponse.of(FlowResponse.Type.ABANDONED), done));

        ConversationOrchestrator.ChatReply reply = orchestrator.process(SESSION, "cancel");

        assertThat(reply.isTerminal()).isTrue();
        assertThat(reply.reply()).isEqualTo(phrases.goodbye());
        assertThat(orchestrator.getState(SESSION)).contains(done);
    }

    @Test
    void endSessionForgetsState() {
        when(understanding.classifyIntent(anyString(), anyList())).thenReturn(ConversationIntent.BOOKING);
        flowReplies(withName("Olena"));
        orchestrator.process(SESSION, "book a meeting, I'm Olena");

        assertThat(orchestrator.endSession(SESSION)).isTrue();
        assertThat(orchestrator.getState(SESSION)).isEmpty();
        assertThat(store.getHistory(SESSION)).isEmpty();
        assertThat(orchestrator.endSession(SESSION)).isFalse();
    }

    @Test
    void idleSessionsAreEvicted() {
        when(understanding.classifyIntent(anyString(), anyList())).thenReturn(ConversationIntent.RAG);
        when(questionAnswering.answer(anyString(), anyList())).thenReturn("Hi");
        orchestrator.process("old", "hello");
        clock.advance(Duration.ofMinutes(20));
        orchestrator.process("recent", "hello");

        clock.advance(Duration.ofMinutes(15));

        assertThat(orchestrator.evictIdleSessions()).isEqualTo(1);
        assertThat(orchestrator.getState("old")).isEmpty();
        assertThat(orchestrator.getState("recent")).isPresent();
        assertThat(orchestrator.activeSessions()).isEqualTo(1);
    }
}
