package com.ai.booking.service;

import com.ai.booking.conversation.ConversationIntent;
import org.springframework.stereotype.Service;

import java.util.regex.Pattern;

/**
 * Keyword rules for the decisions the booking flow makes on raw text: whether the user is
 * leaving, asking for other times, or (when no language model is configured) whether an
 * utterance is about booking at all.
 */
@Service
public class IntentClassifier {

    private static final Pattern BOOKING = Pattern.compile(
            "\\b(book|booking|schedule|meeting|appointment|call|demo|talk|speak|discuss|reserve|calendar|arrange|slots?)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final String EXIT_PHRASE =
            "(?:bye|goodbye|good bye|quit|exit|stop|forget it|never ?mind|cancel(?: the| this| my)?(?: booking| meeting)?|(?:i'?m )?not interested)";

    // matched against the whole utterance: "yes, don't stop" is not an exit
    private static final Pattern EXIT = Pattern.compile(
            "^\\s*(?:(?:ok(?:ay)?|no|please|sorry|actually|thanks)[,\\s]+)*" + EXIT_PHRASE
                    + "(?:[,\\s]+(?:" + EXIT_PHRASE + "|please|thanks|thank you))*[\\s.!]*$",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern CHANGE_TIME = Pattern.compile(
            "\\b(change (the )?(time|slot|day|date)|another (time|slot|day)|different (time|slot|day)|other (times?|slots?|options?)|none of (these|them|those)|something else)\\b",
            Pattern.CASE_INSENSITIVE
    );

    public ConversationIntent classify(String userText) {
        if (userText == null || userText.isBlank()) return ConversationIntent.RAG;
        return BOOKING.matcher(userText).find() ? ConversationIntent.BOOKING : ConversationIntent.RAG;
    }

    public boolean isExit(String userText) {
        return userText != null && EXIT.matcher(userText).matches();
    }

    public boolean isChangeTimeRequest(String userText) {
        return userText != null && CHANGE_TIME.matcher(userText).find();
    }
}
