package com.ai.booking.service;

import com.ai.booking.calendar.BookingSlot;
import com.ai.booking.calendar.FailureKind;
import com.ai.booking.config.BookingProperties;
import com.ai.booking.conversation.BookingRequest;
import com.ai.booking.conversation.BookingResult;
import com.ai.booking.conversation.BookingStage;
import com.ai.booking.conversation.ConversationState;
import com.ai.booking.conversation.QualificationField;
import com.ai.booking.conversation.SlotProposal;
import com.ai.booking.conversation.TurnResult;
import com.ai.booking.conversation.UserInfo;
import com.ai.booking.conversation.UserTurn;
import com.ai.booking.conversation.ValidationError;
import com.ai.booking.conversation.YesNoResult;
import com.ai.booking.dto.FlowResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * The booking state machine. {@link #advance} takes the current state and one user turn and
 * returns the reply plus the next state; the input state is never modified.
 * <p>
 * QUALIFYING -> PROPOSING -> CONFIRMING -> BOOKING -> DONE, with ABANDONED and FAILED as the
 * other terminal stages. Only an explicit yes on a selected slot reaches BOOKING.
 */
@Service
public class BookingFlowService {

    private static final Logger log = LoggerFactory.getLogger(BookingFlowService.class);

    private final QualificationService qualificationService;
    private final AvailabilityService availabilityService;
    private final BookingTransactionService bookingTransactionService;
    private final SlotSelectionParser slotSelectionParser;
    private final YesNoClassifier yesNoClassifier;
    private final IntentClassifier intentClassifier;
    private final BookingProperties properties;

    public BookingFlowService(QualificationService qualificationService, AvailabilityService availabilityService,
                              BookingTransactionService bookingTransactionService, SlotSelectionParser slotSelectionParser,
                              YesNoClassifier yesNoClassifier, IntentClassifier intentClassifier,
                              BookingProperties properties) {
        this.qualificationService = qualificationService;
        this.availabilityService = availabilityService;
        this.bookingTransactionService = bookingTransactionService;
        this.slotSelectionParser = slotSelectionParser;
        this.yesNoClassifier = yesNoClassifier;
        this.intentClassifier = intentClassifier;
        this.properties = properties;
    }

    public TurnResult advance(ConversationState state, UserTurn turn) {
        if (state.isTerminal()) {
            return new TurnResult(terminalResponse(state), state);
        }
        if (intentClassifier.isExit(turn.text())) {
            log.info("User left the flow at {}", state.getStage());
            return new TurnResult(FlowResponse.of(FlowResponse.Type.ABANDONED), state.moveTo(BookingStage.ABANDONED));
        }

        TurnResult result;
        switch (state.getStage()) {
            case QUALIFYING:
            case PROPOSING:
                result = qualify(state, turn);
                break;
            case CONFIRMING:
                result = confirm(state, turn);
                break;
            case BOOKING:
                result = state.getPendingRequest() != null
                        ? book(state, state.getPendingRequest())
                        : propose(state.toBuilder().selectedSlot(null).build());
                break;
            default:
                throw new IllegalStateException("Unhandled stage " + state.getStage());
        }
        if (result.state().getStage() != state.getStage()) {
            log.info("Stage {} -> {} ({})", state.getStage(), result.state().getStage(), result.response().getType());
        }
        return result;
    }

    // ----- QUALIFYING / PROPOSING -----

    private TurnResult qualify(ConversationState state, UserTurn turn) {
        QualificationService.QualificationOutcome outcome = qualificationService.merge(state.getUserInfo(), turn);
        UserInfo info = outcome.userInfo();
        ConversationState next = state.toBuilder().userInfo(info).build();

        if (outcome.hasErrors()) {
            ValidationError error = outcome.errors().get(0);
            log.info("Rejected {} value", error.field());
            return new TurnResult(FlowResponse.invalidField(error.field(), error.rejectedValue()),
                    next.moveTo(BookingStage.QUALIFYING));
        }
        if (!info.isComplete()) {
            return new TurnResult(FlowResponse.askFields(info.missingFields(), info.name()),
                    next.moveTo(BookingStage.QUALIFYING));
        }
        return propose(next);
    }

    /**
     * Query availability for the current qualification and present what was found. Runs in the
     * same turn that completed qualification, changed the preference or lost a slot.
     */
    private TurnResult propose(ConversationState state) {
        UserInfo info = state.getUserInfo();
        ConversationState cleared = state.toBuilder()
                .stage(BookingStage.PROPOSING)
                .proposal(null)
                .selectedSlot(null)
                .pendingRequest(null)
                .bookingAttempts(0)
                .build();

        AvailabilityService.ProposalOutcome outcome = availabilityService.propose(info);
        switch (outcome.kind()) {
            case FOUND:
                SlotProposal proposal = outcome.proposal();
                return new TurnResult(FlowResponse.proposeSlots(proposal.slots(), outcome.widened()),
                        cleared.toBuilder().stage(BookingStage.CONFIRMING).proposal(proposal).build());
            case EMPTY:
                return new TurnResult(FlowResponse.noAvailability(info.timePreference()), backToQualifying(cleared));
            case UNRESOLVABLE:
                return new TurnResult(FlowResponse.invalidField(QualificationField.TIME_PREFERENCE, info.timePreference()), backToQualifying(cleared));
            case FAILED:
            default:
                if (outcome.failure() == FailureKind.TRANSIENT) {
                    return new TurnResult(FlowResponse.of(FlowResponse.Type.AVAILABILITY_ERROR), cleared);
                }
                BookingResult fatal = BookingResult.fatal(toErrorKind(outcome.failure()), "availability query failed");
                return new TurnResult(FlowResponse.failed(fatal),
                        cleared.toBuilder().stage(BookingStage.FAILED).result(fatal).build());
        }
    }

    private static ConversationState backToQualifying(ConversationState state) {
        return state.toBuilder()
                .stage(BookingStage.QUALIFYING)
                .userInfo(state.getUserInfo().withTimePreference(null))
                .build();
    }

    // ----- CONFIRMING -----

    private TurnResult confirm(ConversationState state, UserTurn turn) {
        SlotProposal proposal = state.getProposal();
        Optional<SlotSelectionParser.Selection> selection = slotSelectionParser.parse(turn.text());
        Optional<BookingSlot> picked = selection.flatMap(s -> slotSelectionParser.resolve(s, proposal));

        if (picked.isPresent()) {
            BookingSlot slot = picked.get();
            UserInfo info = state.getUserInfo();
            BookingRequest pending = state.getPendingRequest();
            return new TurnResult(FlowResponse.confirmBooking(info.name(), info.email(), slot),
                    state.toBuilder()
                            .selectedSlot(slot)
                            .pendingRequest(pending != null && pending.slot().equals(slot) ? pending : null)
                            .build());
        }

        QualificationService.QualificationOutcome outcome = qualificationService.merge(state.getUserInfo(), turn);
        if (outcome.timePreferenceChanged()) {
            log.info("Time preference changed to '{}'", outcome.userInfo().timePreference());
            return propose(state.toBuilder().userInfo(outcome.userInfo()).build());
        }

        if (selection.isPresent()) {
            return new TurnResult(FlowResponse.staleSelection(proposal.slots()), state);
        }

        BookingSlot selected = state.getSelectedSlot();
        YesNoResult answer = yesNoClassifier.classify(turn.text());

        if (selected == null) {
            if (answer == YesNoResult.NO || intentClassifier.isChangeTimeRequest(turn.text())) {
                return propose(state);
            }
            return new TurnResult(FlowResponse.selectSlot(proposal.slots()), state);
        }

        if (answer == YesNoResult.YES) {
            BookingRequest request = state.getPendingRequest() != null
                    ? state.getPendingRequest()
                    : BookingRequest.confirmed(state.getUserInfo(), selected);
            return book(state, request);
        }
        if (answer == YesNoResult.NO || intentClassifier.isChangeTimeRequest(turn.text())) {
            return propose(state);
        }
        return new TurnResult(FlowResponse.confirmUnclear(selected), state);
    }

    // ----- BOOKING -----

    private TurnResult book(ConversationState state, BookingRequest request) {
        ConversationState booking = state.toBuilder()
                .stage(BookingStage.BOOKING)
                .pendingRequest(request)
                .selectedSlot(request.slot())
                .bookingAttempts(state.getBookingAttempts() + 1)
                .build();
        log.info("Committing booking for {} at {} (attempt {})",
                request.user().email(), request.slot().start(), booking.getBookingAttempts());

        BookingResult result = bookingTransactionService.commit(request);
        switch (result.status()) {
            case CONFIRMED:
                return new TurnResult(FlowResponse.confirmed(result, request.user().email(), request.slot()),
                        booking.toBuilder().stage(BookingStage.DONE).result(result).build());
            case SLOT_CONFLICT:
                TurnResult fresh = propose(booking.toBuilder().result(result).build());
                if (fresh.response().getType() == FlowResponse.Type.PROPOSE_SLOTS) {
                    return new TurnResult(FlowResponse.slotTaken(fresh.response().getSlots()), fresh.state());
                }
                return fresh;
            case RETRYABLE:
                if (booking.getBookingAttempts() >= properties.getMaxBookingAttempts()) {
                    log.warn("Giving up on {} after {} attempts", request.slot().start(), booking.getBookingAttempts());
                    BookingResult exhausted = BookingResult.fatal(BookingResult.ErrorKind.TRANSIENT,
                            "calendar unavailable after " + booking.getBookingAttempts() + " attempts");
                    return new TurnResult(FlowResponse.failed(exhausted),
                            booking.toBuilder().stage(BookingStage.FAILED).result(exhausted).build());
                }
                return new TurnResult(FlowResponse.retryOffer(request.slot()),
                        booking.toBuilder().stage(BookingStage.CONFIRMING).result(result).build());
            case FATAL:
            default:
                return new TurnResult(FlowResponse.failed(result),
                        booking.toBuilder().stage(BookingStage.FAILED).result(result).build());
        }
    }

    // ----- terminal -----

    private static FlowResponse terminalResponse(ConversationState state) {
        switch (state.getStage()) {
            case DONE:
                return FlowResponse.confirmed(state.getResult(), state.getUserInfo().email(), state.getSelectedSlot());
            case FAILED:
                return FlowResponse.failed(state.getResult());
            case ABANDONED:
            default:
                return FlowResponse.of(FlowResponse.Type.ABANDONED);
        }
    }

    private static BookingResult.ErrorKind toErrorKind(FailureKind kind) {
        if (kind == FailureKind.AUTH) return BookingResult.ErrorKind.AUTH;
        if (kind == FailureKind.TRANSIENT) return BookingResult.ErrorKind.TRANSIENT;
        return BookingResult.ErrorKind.REJECTED;
    }
}
