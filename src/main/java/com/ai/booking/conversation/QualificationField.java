package com.ai.booking.conversation;

public enum QualificationField {
    NAME,
    EMAIL,
    TIME_PREFERENCE
}
