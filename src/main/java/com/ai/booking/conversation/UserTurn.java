package com.ai.booking.conversation;

/**
 * One user input handed to the state machine: the raw text plus whatever fields the
 * extractor found in it.
 */
public record UserTurn(String text, ExtractedFields fields) {

    public UserTurn {
        text = text == null ? "" : text.trim();
        fields = fields == null ? ExtractedFields.none() : fields;
    }

    public static UserTurn of(String text) {
        return new UserTurn(text, ExtractedFields.none());
    }
}
