package com.ai.booking.conversation;

import com.ai.booking.calendar.BookingSlot;
import lombok.Builder;
import lombok.Value;

/**
 * Cursor of one booking flow. Immutable: each turn produces a new state, and callers keep
 * whichever instance they were last given.
 */
@Value
@Builder(toBuilder = true)
public class ConversationState {

    @Builder.Default
    BookingStage stage = BookingStage.QUALIFYING;

    @Builder.Default
    UserInfo userInfo = UserInfo.empty();

    /** Present from PROPOSING onwards; replaced whenever availability is re-queried. */
    SlotProposal proposal;

    /** Slot picked from the current proposal, awaiting an explicit yes. */
    BookingSlot selectedSlot;

    /** Set once the user confirmed; kept across retryable failures so the token is reused. */
    BookingRequest pendingRequest;

    /** Terminal or last commit outcome. */
    BookingResult result;

    /** Commit attempts made for the current request. */
    @Builder.Default
    int bookingAttempts = 0;

    public static ConversationState initial() {
        return ConversationState.builder().build();
    }

    public boolean isTerminal() {
        return stage.isTerminal();
    }

    public ConversationState moveTo(BookingStage next) {
        return toBuilder().stage(next).build();
    }
}
