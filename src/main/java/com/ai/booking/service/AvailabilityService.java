package com.ai.booking.service;

import com.ai.booking.calendar.AvailabilityQueryException;
import com.ai.booking.calendar.BookingSlot;
import com.ai.booking.calendar.BusyInterval;
import com.ai.booking.calendar.CalendarGateway;
import com.ai.booking.calendar.FailureKind;
import com.ai.booking.calendar.TimeWindow;
import com.ai.booking.config.BookingProperties;
import com.ai.booking.conversation.SlotProposal;
import com.ai.booking.conversation.UserInfo;
import io.github.resilience4j.retry.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds slot proposals from live free/busy data. When the requested window has too few
 * free slots the search continues on the following working days.
 */
@Service
public class AvailabilityService {

    private static final Logger log = LoggerFactory.getLogger(AvailabilityService.class);

    private final CalendarGateway calendarGateway;
    private final SlotService slotService;
    private final TimePreferenceResolver timePreferenceResolver;
    private final BookingProperties properties;
    private final Retry calendarRetry;

    public AvailabilityService(CalendarGateway calendarGateway, SlotService slotService,
                               TimePreferenceResolver timePreferenceResolver, BookingProperties properties,
                               Retry calendarRetry) {
        this.calendarGateway = calendarGateway;
        this.slotService = slotService;
        this.timePreferenceResolver = timePreferenceResolver;
        this.properties = properties;
        this.calendarRetry = calendarRetry;
    }

    /**
     * Busy intervals for {@code window}, retrying transient failures within the retry budget.
     *
     * @throws AvailabilityQueryException when the query still fails
     */
    public List<BusyInterval> queryBusy(TimeWindow window) {
        return Retry.decorateSupplier(calendarRetry, () -> calendarGateway.queryBusy(window)).get();
    }

    public ProposalOutcome propose(UserInfo user) {
        Optional<TimeWindow> requested = timePreferenceResolver.resolve(user.timePreference());
        if (requested.isEmpty()) {
            return ProposalOutcome.unresolvable();
        }

        TimeWindow window = requested.get();
        LocalTime dayStart = timePreferenceResolver.preferredStart(user.timePreference());
        List<BookingSlot> collected = new ArrayList<>();
        boolean widened = false;
        try {
            for (int day = 0; day <= properties.getMaxWideningDays(); day++) {
                List<BookingSlot> free = slotService.computeFreeSlots(window, queryBusy(window),
                        properties.getSlotDurationMinutes());
                if (!free.isEmpty() && day > 0) {
                    widened = true;
                }
                collected.addAll(free);
                if (collected.size() >= properties.getMinProposedSlots()) {
                    break;
                }
                window = nextWorkingDay(window, dayStart);
            }
        } catch (AvailabilityQueryException e) {
            log.warn("Availability query failed for '{}': kind={}", user.timePreference(), e.getKind());
            return ProposalOutcome.failed(e.getKind());
        }

        if (collected.isEmpty()) {
            log.info("No free slots for '{}' within {} extra days", user.timePreference(), properties.getMaxWideningDays());
            return ProposalOutcome.empty();
        }
        List<BookingSlot> slots = slotService.selectProposal(collected, properties.getMaxProposedSlots());
        log.info("Proposing {} slots for '{}' (widened={})", slots.size(), user.timePreference(), widened);
        return ProposalOutcome.found(new SlotProposal(slots, user, requested.get()), widened);
    }

    /**
     * Same window on the next working day. A window whose start was clipped to the current
     * time opens again at {@code dayStart}.
     */
    static TimeWindow nextWorkingDay(TimeWindow window, LocalTime dayStart) {
        TimeWindow next = window.shiftDays(1);
        while (isWeekend(next.start().getDayOfWeek())) {
            next = next.shiftDays(1);
        }
        ZonedDateTime start = next.start().toLocalDate().atTime(dayStart).atZone(next.zone());
        if (start.isBefore(next.start())) {
            return new TimeWindow(start, next.end(), next.zone());
        }
        return next;
    }

    private static boolean isWeekend(DayOfWeek day) {
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }

    public record ProposalOutcome(Kind kind, SlotProposal proposal, boolean widened, FailureKind failure) {

        public enum Kind {
            FOUND,
            EMPTY,
            UNRESOLVABLE,
            FAILED
        }

        static ProposalOutcome found(SlotProposal proposal, boolean widened) {
            return new ProposalOutcome(Kind.FOUND, proposal, widened, null);
        }

        static ProposalOutcome empty() {
            return new ProposalOutcome(Kind.EMPTY, null, false, null);
        }

        static ProposalOutcome unresolvable() {
            return new ProposalOutcome(Kind.UNRESOLVABLE, null, false, null);
        }

        static ProposalOutcome failed(FailureKind failure) {
            return new ProposalOutcome(Kind.FAILED, null, false, failure);
        }
    }
}
