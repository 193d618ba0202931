package com.ai.booking.conversation;

import com.ai.booking.calendar.BookingSlot;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * A confirmed booking intent. The idempotency token is fixed when the user confirms and
 * identifies this intent for every later commit attempt.
 */
public record BookingRequest(UserInfo user, BookingSlot slot, String idempotencyToken) {

    public static BookingRequest confirmed(UserInfo user, BookingSlot slot) {
        return new BookingRequest(user, slot, fingerprint(user.email(), slot));
    }

    /**
     * SHA-256 over the normalized attendee email and the slot instants. Hex output is a
     * valid Google Calendar event id.
     */
    static String fingerprint(String email, BookingSlot slot) {
        String material = email.trim().toLowerCase(Locale.ROOT)
                + '|' + slot.start().toInstant()
                + '|' + slot.end().toInstant()
                + '|' + slot.zone().getId();
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(material.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
