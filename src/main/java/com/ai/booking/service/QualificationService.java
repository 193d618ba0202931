package com.ai.booking.service;

import com.ai.booking.conversation.ExtractedFields;
import com.ai.booking.conversation.QualificationField;
import com.ai.booking.conversation.UserInfo;
import com.ai.booking.conversation.UserTurn;
import com.ai.booking.conversation.ValidationError;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.validator.routines.EmailValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Accumulates and validates the qualification fields of one conversation.
 * Invalid values are never stored.
 */
@Service
public class QualificationService {

    private static final Logger log = LoggerFactory.getLogger(QualificationService.class);

    private static final int MAX_NAME_LENGTH = 100;
    private static final Pattern EMAIL_TOKEN = Pattern.compile("[^\\s<>(),;:\"']+@[^\\s<>(),;:\"']+");
    private static final Pattern HAS_LETTER = Pattern.compile("\\p{L}");
    private static final Pattern DATE_WORDS = Pattern.compile(
            "\\b(today|tomorrow|tonight|next|week|morning|afternoon|evening|monday|tuesday|wednesday|thursday|friday|saturday|sunday|am|pm)\\b|\\d",
            Pattern.CASE_INSENSITIVE);

    private final TimePreferenceResolver timePreferenceResolver;
    private final EmailValidator emailValidator = EmailValidator.getInstance();

    public QualificationService(TimePreferenceResolver timePreferenceResolver) {
        this.timePreferenceResolver = timePreferenceResolver;
    }

    /**
     * Apply the fields found in {@code turn} to {@code current}. Name and email are only
     * taken while qualification is incomplete; a new valid time preference always replaces
     * the old one.
     */
    public QualificationOutcome merge(UserInfo current, UserTurn turn) {
        ExtractedFields fields = turn.fields();
        boolean wasComplete = current.isComplete();
        UserInfo info = current;
        List<ValidationError> errors = new ArrayList<>();

        String name = StringUtils.trimToNull(fields.name());
        if (name != null && !wasComplete) {
            if (isValidName(name)) {
                info = info.withName(name);
            } else {
                errors.add(new ValidationError(QualificationField.NAME, name));
            }
        }

        String email = StringUtils.trimToNull(fields.email());
        if (email == null) {
            email = findEmail(turn.text());
        }
        if (email != null && !wasComplete) {
            if (isValidEmail(email)) {
                info = info.withEmail(email);
            } else {
                errors.add(new ValidationError(QualificationField.EMAIL, email));
            }
        }

        String preference = StringUtils.trimToNull(fields.timePreference());
        if (preference != null) {
            if (timePreferenceResolver.isResolvable(preference)) {
                info = info.withTimePreference(preference);
            } else {
                errors.add(new ValidationError(QualificationField.TIME_PREFERENCE, preference));
            }
        }

        if (StringUtils.isBlank(info.name()) && name == null && looksLikeBareName(turn.text(), info)) {
            info = info.withName(turn.text().trim());
            log.info("Using bare reply as name: {}", info.name());
        }

        boolean preferenceChanged = wasComplete && !sameWindow(current.timePreference(), info.timePreference());
        return new QualificationOutcome(info, errors, preferenceChanged);
    }

    private boolean sameWindow(String previous, String next) {
        if (Objects.equals(previous, next)) return true;
        return timePreferenceResolver.resolve(previous).equals(timePreferenceResolver.resolve(next));
    }

    public boolean isValidName(String name) {
        return StringUtils.isNotBlank(name)
                && name.trim().length() <= MAX_NAME_LENGTH
                && !name.contains("@")
                && HAS_LETTER.matcher(name).find();
    }

    public boolean isValidEmail(String email) {
        return email != null && emailValidator.isValid(email.trim());
    }

    static String findEmail(String text) {
        if (text == null) return null;
        Matcher m = EMAIL_TOKEN.matcher(text);
        return m.find() ? StringUtils.stripEnd(m.group(), ".!?") : null;
    }

    /**
     * When only the name is missing, a short plain reply is the name itself.
     */
    private boolean looksLikeBareName(String text, UserInfo info) {
        if (StringUtils.isBlank(info.email()) || StringUtils.isBlank(info.timePreference())) return false;
        String t = StringUtils.trimToEmpty(text);
        return t.length() > 1 && t.length() < 50
                && !t.contains("@")
                && !DATE_WORDS.matcher(t).find()
                && isValidName(t);
    }

    public record QualificationOutcome(UserInfo userInfo, List<ValidationError> errors, boolean timePreferenceChanged) {

        public QualificationOutcome {
            errors = List.copyOf(errors);
        }

        public boolean hasErrors() {
            return !errors.isEmpty();
        }
    }
}
