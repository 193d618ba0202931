package com.ai.booking.service;

import com.ai.booking.conversation.YesNoResult;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Classifies a reply to the booking summary into YES, NO, or UNKNOWN.
 * Only YES moves a booking forward, so mixed or hedged replies are UNKNOWN.
 */
@Service
public class YesNoClassifier {

    private static final Set<String> AFFIRMATIVE_EXACT = Set.of(
            "yes", "yeah", "yep", "yup", "y", "ok", "okay", "sure", "correct", "confirm",
            "confirmed", "book it", "go ahead", "do it", "sounds good", "perfect", "absolutely", "definitely"
    );

    private static final Set<String> NEGATIVE_EXACT = Set.of(
            "no", "nope", "nah", "n", "not yet", "not now", "wait", "hold on", "don't", "dont"
    );

    private static final Pattern AFFIRMATIVE_PATTERN = Pattern.compile(
            "\\b(yes|yeah|yep|yup|ok|okay|sure|correct|confirm|confirmed|go ahead|book it|sounds good|absolutely|definitely|please do)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern NEGATIVE_PATTERN = Pattern.compile(
            "\\b(no|nope|nah|don't|dont|wait|not now|not yet|hold on|change|different|another|other)\\b",
            Pattern.CASE_INSENSITIVE
    );

    public YesNoResult classify(String userInput) {
        if (userInput == null || userInput.isBlank()) {
            return YesNoResult.UNKNOWN;
        }
        String normalized = userInput.trim().toLowerCase(Locale.ROOT).replaceAll("[.!?,]+$", "");

        if (AFFIRMATIVE_EXACT.contains(normalized)) {
            return YesNoResult.YES;
        }
        if (NEGATIVE_EXACT.contains(normalized)) {
            return YesNoResult.NO;
        }

        boolean affirmative = AFFIRMATIVE_PATTERN.matcher(normalized).find();
        boolean negative = NEGATIVE_PATTERN.matcher(normalized).find();
        if (affirmative && negative) {
            return YesNoResult.UNKNOWN;
        }
        if (affirmative) {
            return YesNoResult.YES;
        }
        if (negative) {
            return YesNoResult.NO;
        }
        return YesNoResult.UNKNOWN;
    }

    public boolean isAffirmative(String userInput) {
        return classify(userInput) == YesNoResult.YES;
    }

    public boolean isNegative(String userInput) {
        return classify(userInput) == YesNoResult.NO;
    }
}
