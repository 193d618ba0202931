package com.ai.booking.controller;

import com.ai.booking.dto.ChatRequest;
import com.ai.booking.dto.ChatResponse;
import com.ai.booking.dto.SessionView;
import com.ai.booking.service.ConversationOrchestrator;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Pattern;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Chat transport. The session id is chosen by the client and identifies one conversation.
 */
@RestController
@Validated
@RequestMapping("/api/sessions")
public class ChatController {

    private static final String SESSION_ID = "[A-Za-z0-9_\\-]{1,128}";

    private final ConversationOrchestrator orchestrator;

    public ChatController(ConversationOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping("/{sessionId}/messages")
    public ChatResponse send(@PathVariable @Pattern(regexp = SESSION_ID) String sessionId,
                             @Valid @RequestBody ChatRequest request) {
        ConversationOrchestrator.ChatReply reply = orchestrator.process(sessionId, request.message().trim());
        return new ChatResponse(reply.reply(), reply.state().getStage(), reply.isTerminal(),
                ChatResponse.ResultView.of(reply.state().getResult()));
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<SessionView> get(@PathVariable @Pattern(regexp = SESSION_ID) String sessionId) {
        return orchestrator.getState(sessionId)
                .map(SessionView::of)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Void> end(@PathVariable @Pattern(regexp = SESSION_ID) String sessionId) {
        return orchestrator.endSession(sessionId)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }
}
