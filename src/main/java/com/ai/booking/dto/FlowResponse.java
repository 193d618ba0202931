package com.ai.booking.dto;

import com.ai.booking.calendar.BookingSlot;
import com.ai.booking.conversation.BookingResult;
import com.ai.booking.conversation.QualificationField;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured outcome of one booking turn.
 * No conversational text here, only type and payload. {@code ResponseRenderer} turns it into words.
 */
public final class FlowResponse {

    public enum Type {
        ASK_FIELDS,
        INVALID_FIELD,
        PROPOSE_SLOTS,
        NO_AVAILABILITY,
        AVAILABILITY_ERROR,
        SELECT_SLOT,
        STALE_SELECTION,
        CONFIRM_BOOKING,
        CONFIRM_UNCLEAR,
        CONFIRMED,
        SLOT_TAKEN,
        RETRY_OFFER,
        FAILED,
        ABANDONED,
        ANSWER
    }

    private final Type type;
    private final Map<String, Object> payload;
    private final boolean terminal;

    private FlowResponse(Type type, Map<String, Object> payload, boolean terminal) {
        this.type = type;
        this.payload = payload == null ? Collections.emptyMap() : new HashMap<>(payload);
        this.terminal = terminal;
    }

    public Type getType() {
        return type;
    }

    public Map<String, Object> getPayload() {
        return Collections.unmodifiableMap(payload);
    }

    public String getString(String key) {
        Object v = payload.get(key);
        return v == null ? null : v.toString();
    }

    public boolean getFlag(String key) {
        return Boolean.TRUE.equals(payload.get(key));
    }

    @SuppressWarnings("unchecked")
    public List<BookingSlot> getSlots() {
        Object v = payload.get("slots");
        return v instanceof List ? (List<BookingSlot>) v : List.of();
    }

    @SuppressWarnings("unchecked")
    public List<QualificationField> getMissingFields() {
        Object v = payload.get("missing");
        return v instanceof List ? (List<QualificationField>) v : List.of();
    }

    public BookingResult getResult() {
        Object v = payload.get("result");
        return v instanceof BookingResult ? (BookingResult) v : null;
    }

    public boolean isTerminal() {
        return terminal;
    }

    public static FlowResponse of(Type type) {
        return new FlowResponse(type, null, isTerminalType(type));
    }

    public static FlowResponse of(Type type, Map<String, Object> payload) {
        return new FlowResponse(type, payload, isTerminalType(type));
    }

    private static boolean isTerminalType(Type type) {
        return type == Type.CONFIRMED || type == Type.FAILED || type == Type.ABANDONED;
    }

    public static FlowResponse askFields(List<QualificationField> missing, String knownName) {
        Map<String, Object> p = new HashMap<>();
        p.put("missing", List.copyOf(missing));
        if (knownName != null) p.put("name", knownName);
        return of(Type.ASK_FIELDS, p);
    }

    public static FlowResponse invalidField(QualificationField field, String rejectedValue) {
        Map<String, Object> p = new HashMap<>();
        p.put("field", field.name());
        if (rejectedValue != null) p.put("value", rejectedValue);
        return of(Type.INVALID_FIELD, p);
    }

    public static FlowResponse proposeSlots(List<BookingSlot> slots, boolean widened) {
        Map<String, Object> p = new HashMap<>();
        p.put("slots", List.copyOf(slots));
        p.put("widened", widened);
        return of(Type.PROPOSE_SLOTS, p);
    }

    public static FlowResponse noAvailability(String timePreference) {
        Map<String, Object> p = new HashMap<>();
        p.put("preference", timePreference);
        return of(Type.NO_AVAILABILITY, p);
    }

    public static FlowResponse staleSelection(List<BookingSlot> slots) {
        Map<String, Object> p = new HashMap<>();
        p.put("slots", List.copyOf(slots));
        return of(Type.STALE_SELECTION, p);
    }

    public static FlowResponse confirmBooking(String name, String email, BookingSlot slot) {
        Map<String, Object> p = new HashMap<>();
        p.put("name", name);
        p.put("email", email);
        p.put("slots", List.of(slot));
        return of(Type.CONFIRM_BOOKING, p);
    }

    public static FlowResponse confirmed(BookingResult result, String email, BookingSlot slot) {
        Map<String, Object> p = new HashMap<>();
        p.put("result", result);
        p.put("email", email);
        p.put("slots", List.of(slot));
        if (result.link() != null) p.put("link", result.link());
        return of(Type.CONFIRMED, p);
    }

    public static FlowResponse slotTaken(List<BookingSlot> freshSlots) {
        Map<String, Object> p = new HashMap<>();
        p.put("slots", List.copyOf(freshSlots));
        return of(Type.SLOT_TAKEN, p);
    }

    public static FlowResponse failed(BookingResult result) {
        Map<String, Object> p = new HashMap<>();
        if (result != null) p.put("result", result);
        return of(Type.FAILED, p);
    }

    public static FlowResponse answer(String text) {
        Map<String, Object> p = new HashMap<>();
        p.put("text", text);
        return of(Type.ANSWER, p);
    }

    public static FlowResponse selectSlot(List<BookingSlot> slots) {
        Map<String, Object> p = new HashMap<>();
        p.put("slots", List.copyOf(slots));
        return of(Type.SELECT_SLOT, p);
    }

    public static FlowResponse confirmUnclear(BookingSlot slot) {
        Map<String, Object> p = new HashMap<>();
        p.put("slots", List.of(slot));
        return of(Type.CONFIRM_UNCLEAR, p);
    }

    public static FlowResponse retryOffer(BookingSlot slot) {
        Map<String, Object> p = new HashMap<>();
        p.put("slots", List.of(slot));
        return of(Type.RETRY_OFFER, p);
    }

    @Override
    public String toString() {
        return "FlowResponse{" + type + ", " + payload.keySet() + "}";
    }
}
