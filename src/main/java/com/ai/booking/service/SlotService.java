package com.ai.booking.service;

import com.ai.booking.calendar.BookingSlot;
import com.ai.booking.calendar.BusyInterval;
import com.ai.booking.calendar.TimeWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Slot generation from free/busy data. Pure computation: the calendar is the only source of
 * truth for availability and is queried elsewhere.
 */
@Service
public class SlotService {

    private static final Logger log = LoggerFactory.getLogger(SlotService.class);

    /**
     * Free fixed-length slots inside {@code window}, chronological.
     * <p>
     * Busy intervals are clipped to the window, merged where they overlap or touch, and the
     * gaps between them are cut into back-to-back slots starting at each gap's start.
     * A remainder shorter than one slot is dropped. A slot may end exactly where a busy
     * interval starts, or start exactly where one ends.
     */
    public List<BookingSlot> computeFreeSlots(TimeWindow window, Collection<BusyInterval> busy, int slotDurationMinutes) {
        if (slotDurationMinutes <= 0) {
            throw new IllegalArgumentException("Slot duration must be positive: " + slotDurationMinutes);
        }
        Duration length = Duration.ofMinutes(slotDurationMinutes);
        List<BusyInterval> merged = mergeBusy(window, busy);

        List<BookingSlot> slots = new ArrayList<>();
        ZonedDateTime freeStart = window.start();
        for (BusyInterval range : merged) {
            emitSlots(freeStart, range.start(), length, window.zone(), slots);
            freeStart = range.end();
        }
        emitSlots(freeStart, window.end(), length, window.zone(), slots);

        log.debug("Window [{} - {}]: {} busy ranges -> {} free slots of {}m",
                window.start(), window.end(), merged.size(), slots.size(), slotDurationMinutes);
        return slots;
    }

    /**
     * Clip to the window and merge into maximal disjoint ranges, sorted by start.
     */
    List<BusyInterval> mergeBusy(TimeWindow window, Collection<BusyInterval> busy) {
        ZoneId zone = window.zone();
        List<BusyInterval> clipped = new ArrayList<>();
        if (busy != null) {
            for (BusyInterval b : busy) {
                BusyInterval local = b.inZone(zone);
                ZonedDateTime start = later(local.start(), window.start());
                ZonedDateTime end = earlier(local.end(), window.end());
                if (start.isBefore(end)) {
                    clipped.add(new BusyInterval(start, end));
                }
            }
        }
        clipped.sort(Comparator.comparing(BusyInterval::start));

        List<BusyInterval> merged = new ArrayList<>();
        BusyInterval current = null;
        for (BusyInterval next : clipped) {
            if (current == null) {
                current = next;
            } else if (!next.start().isAfter(current.end())) {
                current = new BusyInterval(current.start(), later(current.end(), next.end()));
            } else {
                merged.add(current);
                current = next;
            }
        }
        if (current != null) {
            merged.add(current);
        }
        return merged;
    }

    /**
     * First {@code max} distinct slots in chronological order.
     */
    public List<BookingSlot> selectProposal(List<BookingSlot> freeSlots, int max) {
        return freeSlots.stream()
                .distinct()
                .sorted(Comparator.comparing(BookingSlot::start))
                .limit(Math.max(0, max))
                .toList();
    }

    /** True when no busy interval strictly overlaps the slot. */
    public boolean isFree(BookingSlot slot, Collection<BusyInterval> busy) {
        return busy == null || busy.stream().noneMatch(slot::overlaps);
    }

    private static void emitSlots(ZonedDateTime from, ZonedDateTime to, Duration length, ZoneId zone,
                                  List<BookingSlot> out) {
        for (ZonedDateTime t = from; !t.plus(length).isAfter(to); t = t.plus(length)) {
            out.add(new BookingSlot(t, t.plus(length), zone));
        }
    }

    private static ZonedDateTime later(ZonedDateTime a, ZonedDateTime b) {
        return a.isAfter(b) ? a : b;
    }

    private static ZonedDateTime earlier(ZonedDateTime a, ZonedDateTime b) {
        return a.isBefore(b) ? a : b;
    }
}
