package com.ai.booking.service;

import com.ai.booking.calendar.BookingSlot;
import com.ai.booking.component.ResponsePhrases;
import com.ai.booking.conversation.BookingResult;
import com.ai.booking.conversation.QualificationField;
import com.ai.booking.dto.FlowResponse;
import org.springframework.stereotype.Service;

import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Converts structured FlowResponse into chat text.
 * No flow logic, only type + payload to human-friendly sentences.
 */
@Service
public class ResponseRenderer {

    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("EEE d MMM", Locale.ENGLISH);
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm", Locale.ENGLISH);

    private final ResponsePhrases phrases;

    public ResponseRenderer(ResponsePhrases phrases) {
        this.phrases = phrases;
    }

    public String toText(FlowResponse response) {
        if (response == null)
            return "";
        switch (response.getType()) {
            case ASK_FIELDS:
                return askFields(response.getMissingFields(), response.getString("name"));
            case INVALID_FIELD:
                return invalidField(response);
            case PROPOSE_SLOTS:
                return phrases.slotsIntro(response.getFlag("widened")) + "\n"
                        + numbered(response.getSlots()) + "\n" + phrases.pickSlot();
            case NO_AVAILABILITY:
                return phrases.noAvailability(response.getString("preference"));
            case AVAILABILITY_ERROR:
                return phrases.availabilityError();
            case SELECT_SLOT:
                return phrases.pickSlot() + "\n" + numbered(response.getSlots());
            case STALE_SELECTION:
                return phrases.staleSelection() + "\n" + numbered(response.getSlots()) + "\n" + phrases.pickSlot();
            case CONFIRM_BOOKING:
                return phrases.confirmBookingPrompt(response.getString("name"), response.getString("email"),
                        firstSlot(response));
            case CONFIRM_UNCLEAR:
                return phrases.confirmUnclear(firstSlot(response));
            case CONFIRMED:
                String text = phrases.bookingConfirmed(firstSlot(response), response.getString("email"));
                String link = response.getString("link");
                return link != null ? text + "\n" + phrases.calendarLink(link) : text;
            case SLOT_TAKEN:
                return phrases.slotTaken() + "\n" + numbered(response.getSlots()) + "\n" + phrases.pickSlot();
            case RETRY_OFFER:
                return phrases.retryOffer(firstSlot(response));
            case FAILED:
                BookingResult result = response.getResult();
                return result != null && result.error() != BookingResult.ErrorKind.REJECTED
                        ? phrases.bookingBlocked()
                        : phrases.bookingFailed();
            case ABANDONED:
                return phrases.goodbye();
            case ANSWER:
                String answer = response.getString("text");
                return answer == null || answer.isBlank() ? phrases.cannotAnswer() : answer;
            default:
                return "";
        }
    }

    private String askFields(List<QualificationField> missing, String name) {
        if (missing.contains(QualificationField.NAME) && missing.contains(QualificationField.EMAIL))
            return phrases.askNameAndEmail();
        if (missing.contains(QualificationField.NAME))
            return phrases.askName();
        if (missing.contains(QualificationField.EMAIL))
            return phrases.askEmail(name);
        return phrases.askTimePreference(name);
    }

    private String invalidField(FlowResponse response) {
        String value = response.getString("value");
        switch (QualificationField.valueOf(response.getString("field"))) {
            case NAME:
                return phrases.invalidName();
            case EMAIL:
                return phrases.invalidEmail(value);
            case TIME_PREFERENCE:
            default:
                return phrases.invalidTimePreference(value);
        }
    }

    private String firstSlot(FlowResponse response) {
        List<BookingSlot> slots = response.getSlots();
        return slots.isEmpty() ? "" : format(slots.get(0));
    }

    private static String numbered(List<BookingSlot> slots) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < slots.size(); i++) {
            if (i > 0) sb.append('\n');
            sb.append(i + 1).append(". ").append(format(slots.get(i)));
        }
        return sb.toString();
    }

    static String format(BookingSlot slot) {
        return slot.start().format(DAY) + ", " + slot.start().format(TIME) + "-" + slot.end().format(TIME);
    }
}
