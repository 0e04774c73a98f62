package com.ai.clinicdesk.dto;

import java.util.List;

/**
 * Result of feeding one message to the booking state machine.
 *
 * @param draft      booking fields after the message (unchanged apart from the attempt counter on INVALID)
 * @param outcome    what happened
 * @param candidates ids to offer again when the input matched more than one option
 */
public record BookingTransition(BookingDraft draft, Outcome outcome, List<String> candidates) {

    public enum Outcome {
        STARTED,
        ADVANCED,
        INVALID,
        AMBIGUOUS,
        COMPLETED,
        CANCELLED,
        ABANDONED
    }

    public BookingTransition {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    public static BookingTransition of(BookingDraft draft, Outcome outcome) {
        return new BookingTransition(draft, outcome, List.of());
    }
}
