package com.ai.booking.conversation;

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Qualification fields collected so far. Only validated values are ever stored;
 * a null field is simply not known yet.
 */
public record UserInfo(String name, String email, String timePreference) {

    private static final UserInfo EMPTY = new UserInfo(null, null, null);

    public static UserInfo empty() {
        return EMPTY;
    }

    public UserInfo withName(String value) {
        return new UserInfo(value, email, timePreference);
    }

    public UserInfo withEmail(String value) {
        return new UserInfo(name, value, timePreference);
    }

    public UserInfo withTimePreference(String value) {
        return new UserInfo(name, email, value);
    }

    public List<QualificationField> missingFields() {
        List<QualificationField> missing = new ArrayList<>(3);
        if (StringUtils.isBlank(name)) missing.add(QualificationField.NAME);
        if (StringUtils.isBlank(email)) missing.add(QualificationField.EMAIL);
        if (StringUtils.isBlank(timePreference)) missing.add(QualificationField.TIME_PREFERENCE);
        return missing;
    }

    public boolean isComplete() {
        return missingFields().isEmpty();
    }
}
