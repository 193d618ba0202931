package com.ai.booking.dto;

import com.ai.booking.calendar.BookingSlot;
import com.ai.booking.conversation.BookingStage;
import com.ai.booking.conversation.ConversationState;
import com.ai.booking.conversation.QualificationField;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Read-only snapshot of a session's booking flow.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionView(BookingStage stage,
                          String name,
                          String email,
                          String timePreference,
                          List<QualificationField> missingFields,
                          List<SlotView> proposedSlots,
                          SlotView selectedSlot,
                          ChatResponse.ResultView result) {

    public static SessionView of(ConversationState state) {
        List<SlotView> proposed = state.getProposal() == null ? null
                : state.getProposal().slots().stream().map(SlotView::of).collect(Collectors.toList());
        return new SessionView(
                state.getStage(),
                state.getUserInfo().name(),
                state.getUserInfo().email(),
                state.getUserInfo().timePreference(),
                state.getUserInfo().missingFields(),
                proposed,
                state.getSelectedSlot() == null ? null : SlotView.of(state.getSelectedSlot()),
                ChatResponse.ResultView.of(state.getResult()));
    }

    public record SlotView(OffsetDateTime start, OffsetDateTime end, String timezone) {

        static SlotView of(BookingSlot slot) {
            return new SlotView(slot.start().toOffsetDateTime(), slot.end().toOffsetDateTime(), slot.zone().getId());
        }
    }
}
