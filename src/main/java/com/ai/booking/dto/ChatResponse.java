package com.ai.booking.dto;

import com.ai.booking.conversation.BookingResult;
import com.ai.booking.conversation.BookingStage;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Reply to one chat message. {@code result} is present once a booking was attempted.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatResponse(String reply, BookingStage stage, boolean terminal, ResultView result) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ResultView(BookingResult.Status status, String eventId, String link, BookingResult.ErrorKind error) {

        public static ResultView of(BookingResult result) {
            return result == null ? null
                    : new ResultView(result.status(), result.eventId(), result.link(), result.error());
        }
    }
}
