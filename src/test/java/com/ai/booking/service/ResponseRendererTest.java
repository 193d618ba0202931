package com.ai.booking.service;

import com.ai.booking.component.ResponsePhrases;
import com.ai.booking.conversation.BookingResult;
import com.ai.booking.conversation.QualificationField;
import com.ai.booking.dto.FlowResponse;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.ai.booking.BookingTestSupport.TODAY;
import static com.ai.booking.BookingTestSupport.slot;
import static org.assertj.core.api.Assertions.assertThat;

class ResponseRendererTest {

    private final ResponsePhrases phrases = new ResponsePhrases();
    private final ResponseRenderer renderer = new ResponseRenderer(phrases);

    @Test
    void slotFormat() {
        assertThat(ResponseRenderer.format(slot(TODAY, 10, 0))).isEqualTo("Mon 10 Mar, 10:00-10:30");
    }

    @Test
    void proposalIsNumberedInOrder() {
        String text = renderer.toText(FlowResponse.proposeSlots(
                List.of(slot(TODAY, 10, 0), slot(TODAY, 14, 30)), false));

        assertThat(text).startsWith(phrases.slotsIntro(false))
                .contains("1. Mon 10 Mar, 10:00-10:30\n2. Mon 10 Mar, 14:30-15:00")
                .endsWith(phrases.pickSlot());
    }

    @Test
    void widenedProposalSaysSo() {
        String text = renderer.toText(FlowResponse.proposeSlots(List.of(slot(TODAY.plusDays(1), 9, 0)), true));

        assertThat(text).startsWith(phrases.slotsIntro(true));
    }

    @Test
    void asksForWhatIsMissing() {
        assertThat(renderer.toText(FlowResponse.askFields(
                List.of(QualificationField.NAME, QualificationField.EMAIL, QualificationField.TIME_PREFERENCE), null)))
                .isEqualTo(phrases.askNameAndEmail());
        assertThat(renderer.toText(FlowResponse.askFields(List.of(QualificationField.EMAIL), "Olena")))
                .isEqualTo(phrases.askEmail("Olena"));
        assertThat(renderer.toText(FlowResponse.askFields(List.of(QualificationField.TIME_PREFERENCE), "Olena")))
                .isEqualTo(phrases.askTimePreference("Olena"));
    }

    @Test
    void invalidEmailQuotesTheValue() {
        assertThat(renderer.toText(FlowResponse.invalidField(QualificationField.EMAIL, "olena@")))
                .contains("\"olena@\"");
    }

    @Test
    void confirmationIncludesLinkWhenPresent() {
        String text = renderer.toText(FlowResponse.confirmed(
                BookingResult.confirmed("evt1", "https://calendar.example/evt1"), "olena@example.com", slot(TODAY, 10, 0)));

        assertThat(text).contains("Mon 10 Mar, 10:00-10:30")
                .contains("olena@example.com")
                .endsWith(phrases.calendarLink("https://calendar.example/evt1"));
    }

    @Test
    void authFailureIsReportedAsBlocked() {
        assertThat(renderer.toText(FlowResponse.failed(BookingResult.fatal(BookingResult.ErrorKind.AUTH, "401"))))
                .isEqualTo(phrases.bookingBlocked());
        assertThat(renderer.toText(FlowResponse.failed(BookingResult.fatal(BookingResult.ErrorKind.REJECTED, "400"))))
                .isEqualTo(phrases.bookingFailed());
    }

    @Test
    void exhaustedRetriesAskToContactTheTeam() {
        BookingResult exhausted = BookingResult.fatal(BookingResult.ErrorKind.TRANSIENT, "calendar unavailable after 3 attempts");

        assertThat(renderer.toText(FlowResponse.failed(exhausted))).isEqualTo(phrases.bookingBlocked());
    }

    @Test
    void emptyAnswerFallsBack() {
        assertThat(renderer.toText(FlowResponse.answer(""))).isEqualTo(phrases.cannotAnswer());
        assertThat(renderer.toText(FlowResponse.answer("We are open 9 to 5."))).isEqualTo("We are open 9 to 5.");
    }
}
