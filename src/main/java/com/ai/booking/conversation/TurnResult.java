package com.ai.booking.conversation;

import com.ai.booking.dto.FlowResponse;

/**
 * What {@code advance} hands back: the structured reply and the state to keep for the next turn.
 */
public record TurnResult(FlowResponse response, ConversationState state) {

    public boolean isTerminal() {
        return state.isTerminal();
    }
}
