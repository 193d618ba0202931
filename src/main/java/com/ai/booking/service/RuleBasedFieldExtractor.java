package com.ai.booking.service;

import com.ai.booking.conversation.ExtractedFields;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern-based field extraction used when no language model is configured or the model call
 * fails. Catches the common phrasings only ("my name is ...", an address, "tomorrow morning").
 */
@Component
public class RuleBasedFieldExtractor {

    private static final Pattern NAME = Pattern.compile(
            "\\b(?:my name is|my name's|i am|i'm|this is|call me)\\s+([\\p{L}][\\p{L}'\\-]*(?:\\s+(?!(?:and|my|email|here|at|from|i)\\b)[\\p{L}][\\p{L}'\\-]*)?)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern NOT_A_NAME = Pattern.compile(
            "^(looking|trying|interested|available|free|busy|not|fine|good|ok|okay|here|going|booking|wondering)\\b",
            Pattern.CASE_INSENSITIVE);

    private final TimePreferenceResolver timePreferenceResolver;

    public RuleBasedFieldExtractor(TimePreferenceResolver timePreferenceResolver) {
        this.timePreferenceResolver = timePreferenceResolver;
    }

    public ExtractedFields extract(String utterance) {
        if (StringUtils.isBlank(utterance)) return ExtractedFields.none();
        String name = findName(utterance);
        String email = QualificationService.findEmail(utterance);
        String textWithoutEmail = email != null ? utterance.replace(email, " ") : utterance;
        String preference = timePreferenceResolver.isResolvable(textWithoutEmail) ? textWithoutEmail.trim() : null;
        return new ExtractedFields(name, email, preference);
    }

    static String findName(String utterance) {
        Matcher m = NAME.matcher(utterance);
        if (!m.find()) return null;
        String candidate = m.group(1).trim();
        if (NOT_A_NAME.matcher(candidate).find()) return null;
        return StringUtils.capitalize(candidate);
    }
}
