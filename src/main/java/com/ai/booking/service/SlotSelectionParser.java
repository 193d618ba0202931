package com.ai.booking.service;

import com.ai.booking.calendar.BookingSlot;
import com.ai.booking.conversation.SlotProposal;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads which proposed slot the user picked: by list number ("2", "the second one",
 * "option 3") or by restating its start time ("10:30", "2pm", "tomorrow at 2pm").
 */
@Component
public class SlotSelectionParser {

    private static final Pattern NUMBER = Pattern.compile("^\\s*(?:#|no\\.?\\s*|number\\s+|option\\s+|slot\\s+)?(\\d{1,2})\\s*[.!)]?\\s*$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern NUMBER_WITH_NOUN = Pattern.compile("\\b(?:option|slot|number|#)\\s*(\\d{1,2})\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Map<String, Integer> ORDINALS = Map.of(
            "first", 1, "1st", 1,
            "second", 2, "2nd", 2,
            "third", 3, "3rd", 3,
            "fourth", 4, "4th", 4,
            "fifth", 5, "5th", 5
    );
    private static final Pattern ORDINAL = Pattern.compile("\\b(first|1st|second|2nd|third|3rd|fourth|4th|fifth|5th)\\b");

    private final TimePreferenceResolver timePreferenceResolver;

    public SlotSelectionParser(TimePreferenceResolver timePreferenceResolver) {
        this.timePreferenceResolver = timePreferenceResolver;
    }

    /**
     * @return the selection kind found in the text, or empty when the text is not a selection
     */
    public Optional<Selection> parse(String text) {
        if (text == null || text.isBlank()) return Optional.empty();
        String t = text.toLowerCase(Locale.ROOT);

        Optional<LocalTime> time = TimePreferenceResolver.parseClockTime(t);
        if (time.isPresent()) {
            return Optional.of(Selection.byTime(time.get(), timePreferenceResolver.mentionedDate(t).orElse(null)));
        }
        OptionalInt number = parseNumber(t);
        if (number.isPresent()) {
            return Optional.of(Selection.byNumber(number.getAsInt()));
        }
        return Optional.empty();
    }

    /**
     * Resolve a selection against the current proposal. Empty when it points at nothing in it.
     */
    public Optional<BookingSlot> resolve(Selection selection, SlotProposal proposal) {
        if (proposal == null) return Optional.empty();
        return selection.time() != null
                ? proposal.byStartTime(selection.time(), selection.date())
                : proposal.byNumber(selection.number());
    }

    private static OptionalInt parseNumber(String t) {
        Matcher bare = NUMBER.matcher(t);
        if (bare.matches()) return OptionalInt.of(Integer.parseInt(bare.group(1)));
        Matcher noun = NUMBER_WITH_NOUN.matcher(t);
        if (noun.find()) return OptionalInt.of(Integer.parseInt(noun.group(1)));
        Matcher ordinal = ORDINAL.matcher(t);
        if (ordinal.find()) return OptionalInt.of(ORDINALS.get(ordinal.group(1)));
        return OptionalInt.empty();
    }

    /** {@code date} is set only when a restated time also names its day. */
    public record Selection(Integer number, LocalTime time, LocalDate date) {

        static Selection byNumber(int number) {
            return new Selection(number, null, null);
        }

        static Selection byTime(LocalTime time, LocalDate date) {
            return new Selection(null, time, date);
        }
    }
}
