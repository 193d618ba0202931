package com.ai.booking.conversation;

import com.ai.booking.calendar.BookingSlot;
import com.ai.booking.calendar.TimeWindow;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Optional;

/**
 * Slots presented to the user, in chronological order, together with the qualification
 * snapshot and search window they were computed for.
 */
public record SlotProposal(List<BookingSlot> slots, UserInfo basis, TimeWindow window) {

    public SlotProposal {
        slots = List.copyOf(slots);
    }

    /** 1-based lookup, as the user sees the list. */
    public Optional<BookingSlot> byNumber(int number) {
        if (number < 1 || number > slots.size()) return Optional.empty();
        return Optional.of(slots.get(number - 1));
    }

    /** Slot starting at {@code time}, on {@code date} when one is given. */
    public Optional<BookingSlot> byStartTime(LocalTime time, LocalDate date) {
        return slots.stream()
                .filter(s -> s.start().toLocalTime().equals(time))
                .filter(s -> date == null || s.start().toLocalDate().equals(date))
                .findFirst();
    }

    public boolean contains(BookingSlot slot) {
        return slots.contains(slot);
    }

    public boolean isEmpty() {
        return slots.isEmpty();
    }

    public int size() {
        return slots.size();
    }
}
