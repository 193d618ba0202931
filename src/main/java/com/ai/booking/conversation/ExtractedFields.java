package com.ai.booking.conversation;

import org.apache.commons.lang3.StringUtils;

/**
 * Best-effort fields pulled out of one utterance by the language-understanding service.
 * Any of them may be null; none of them is validated.
 */
public record ExtractedFields(String name, String email, String timePreference) {

    private static final ExtractedFields NONE = new ExtractedFields(null, null, null);

    public static ExtractedFields none() {
        return NONE;
    }

    public boolean isEmpty() {
        return StringUtils.isAllBlank(name, email, timePreference);
    }
}
