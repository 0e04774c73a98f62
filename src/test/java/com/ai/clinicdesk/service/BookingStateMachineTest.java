package com.ai.clinicdesk.service;

import com.ai.clinicdesk.ReferenceFixtures;
import com.ai.clinicdesk.component.DateParser;
import com.ai.clinicdesk.component.ReferenceMatcher;
import com.ai.clinicdesk.conversation.BookingStep;
import com.ai.clinicdesk.conversation.ClassificationResult;
import com.ai.clinicdesk.conversation.Confidence;
import com.ai.clinicdesk.conversation.EntityType;
import com.ai.clinicdesk.conversation.EntityValue;
import com.ai.clinicdesk.conversation.Intent;
import com.ai.clinicdesk.dto.BookingDraft;
import com.ai.clinicdesk.dto.BookingTransition;
import com.ai.clinicdesk.dto.BookingTransition.Outcome;
import com.ai.clinicdesk.dto.ReferenceSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalTime;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("BookingStateMachine Unit Tests")
class BookingStateMachineTest {

    private final BookingStateMachine machine = new BookingStateMachine(
            new ReferenceMatcher(0.80), new DateParser(ReferenceFixtures.clock()), 3);
    private final ReferenceSnapshot snapshot = ReferenceFixtures.snapshot();

    private BookingDraft at(BookingStep step) {
        return BookingDraft.builder().step(step).name("Mohammed Ali").phone("0501234567").build();
    }

    @Test
    @DisplayName("Should walk every step to completion")
    void shouldCompleteHappyPath() {
        // Given
        BookingDraft draft = machine.start(null);
        assertThat(draft.getStep()).isEqualTo(BookingStep.NAME);

        // When
        draft = step(draft, "My name is Mohammed Ali", Outcome.ADVANCED);
        draft = step(draft, "sure, 0501234567", Outcome.ADVANCED);
        draft = step(draft, "2", Outcome.ADVANCED);
        draft = step(draft, "olaya", Outcome.ADVANCED);
        BookingTransition done = machine.advance(draft, "tomorrow at 5pm", snapshot);

        // Then
        assertThat(done.outcome()).isEqualTo(Outcome.COMPLETED);
        BookingDraft result = done.draft();
        assertThat(result.getStep()).isEqualTo(BookingStep.DONE);
        assertThat(result.getName()).isEqualTo("Mohammed Ali");
        assertThat(result.getPhone()).isEqualTo("0501234567");
        assertThat(result.getServiceId()).isEqualTo("S02");
        assertThat(result.getBranchId()).isEqualTo("B01");
        assertThat(result.getPreferredDate()).isEqualTo(ReferenceFixtures.TODAY.plusDays(1));
        assertThat(result.getPreferredTime()).isEqualTo(LocalTime.of(17, 0));
    }

    @Test
    @DisplayName("Should reach DONE when both optional steps are skipped")
    void shouldSkipOptionalSteps() {
        BookingDraft draft = step(at(BookingStep.BRANCH).toBuilder().serviceId("S01").build(), "skip", Outcome.ADVANCED);
        assertThat(draft.getStep()).isEqualTo(BookingStep.DATE_TIME);
        assertThat(draft.getBranchId()).isNull();

        BookingTransition done = machine.advance(draft, "no preference", snapshot);

        assertThat(done.outcome()).isEqualTo(Outcome.COMPLETED);
        assertThat(done.draft().getPreferredDate()).isNull();
    }

    @Test
    @DisplayName("Should not ask again for fields named in the booking request")
    void shouldPrefillFromRequest() {
        // Given
        ClassificationResult request = new ClassificationResult(Intent.BOOKING_REQUEST, Map.of(
                EntityType.SERVICE, EntityValue.reference("cleaning", "S01"),
                EntityType.DATE, EntityValue.date("tomorrow", ReferenceFixtures.TODAY.plusDays(1))),
                Confidence.HIGH, ClassificationResult.Source.RULES, true);

        // When
        BookingDraft draft = machine.start(request);
        draft = step(draft, "Mohammed Ali", Outcome.ADVANCED);
        draft = step(draft, "0501234567", Outcome.ADVANCED);

        // Then
        assertThat(draft.getStep()).isEqualTo(BookingStep.BRANCH);
        assertThat(machine.advance(draft, "skip", snapshot).outcome()).isEqualTo(Outcome.COMPLETED);
    }

    @Nested
    @DisplayName("Invalid input")
    class Invalid {

        @Test
        @DisplayName("Should keep every field when the phone is invalid")
        void shouldLeaveDraftUntouched() {
            BookingDraft before = at(BookingStep.PHONE).toBuilder().phone(null).build();

            BookingTransition t = machine.advance(before, "call me later", snapshot);

            assertThat(t.outcome()).isEqualTo(Outcome.INVALID);
            assertThat(t.draft()).isEqualTo(before.toBuilder().invalidAttempts(1).build());
        }

        @ParameterizedTest
        @ValueSource(strings = {"book", "I want an appointment", "12345", "?"})
        @DisplayName("Should reject text that is not a name")
        void shouldRejectNonNames(String text) {
            assertThat(machine.advance(BookingDraft.start(), text, snapshot).outcome()).isEqualTo(Outcome.INVALID);
        }

        @Test
        @DisplayName("Should reject dates in the past")
        void shouldRejectPastDate() {
            assertThat(machine.advance(at(BookingStep.DATE_TIME), "2026-01-01", snapshot).outcome())
                    .isEqualTo(Outcome.INVALID);
        }

        @Test
        @DisplayName("Should abandon after three invalid inputs in a row")
        void shouldAbandon() {
            BookingDraft draft = at(BookingStep.PHONE).toBuilder().phone(null).build();
            draft = step(draft, "nope", Outcome.INVALID);
            draft = step(draft, "still no", Outcome.INVALID);

            BookingTransition t = machine.advance(draft, "12", snapshot);

            assertThat(t.outcome()).isEqualTo(Outcome.ABANDONED);
            assertThat(t.draft().getStep()).isEqualTo(BookingStep.CANCELLED);
        }

        @Test
        @DisplayName("Should reset the attempt counter after a valid answer")
        void shouldResetAttempts() {
            BookingDraft draft = step(at(BookingStep.PHONE).toBuilder().phone(null).build(), "nope", Outcome.INVALID);

            BookingDraft next = step(draft, "0559876543", Outcome.ADVANCED);

            assertThat(next.getInvalidAttempts()).isZero();
        }
    }

    @Test
    @DisplayName("Should offer the candidates again on an ambiguous choice without counting an attempt")
    void shouldReportAmbiguity() {
        BookingTransition t = machine.advance(at(BookingStep.SERVICE), "teeth", snapshot);

        assertThat(t.outcome()).isEqualTo(Outcome.AMBIGUOUS);
        assertThat(t.candidates()).containsExactly("S01", "S02");
        assertThat(t.draft().getInvalidAttempts()).isZero();
    }

    @Test
    @DisplayName("Should not count an attempt when reference data is missing")
    void shouldWaitForReferenceData() {
        BookingTransition t = machine.advance(at(BookingStep.SERVICE), "cleaning", null);

        assertThat(t.outcome()).isEqualTo(Outcome.INVALID);
        assertThat(t.draft().getInvalidAttempts()).isZero();
    }

    @ParameterizedTest
    @ValueSource(strings = {"cancel", "please stop", "الغاء"})
    @DisplayName("Should cancel from any step")
    void shouldCancel(String text) {
        BookingTransition t = machine.advance(at(BookingStep.SERVICE), text, snapshot);

        assertThat(t.outcome()).isEqualTo(Outcome.CANCELLED);
        assertThat(t.draft().getStep()).isEqualTo(BookingStep.CANCELLED);
    }

    @ParameterizedTest
    @ValueSource(strings = {"لا اريد فرع معين", "ما ابي فرع محدد"})
    @DisplayName("Should read 'I don't want' on an optional step as a skip, not a cancel")
    void shouldSkipOnDeclinedOptionalField(String text) {
        // Given
        BookingDraft draft = at(BookingStep.BRANCH).toBuilder().serviceId("S01").build();

        // When
        BookingTransition t = machine.advance(draft, text, snapshot);

        // Then
        assertThat(t.outcome()).isEqualTo(Outcome.ADVANCED);
        assertThat(t.draft().getStep()).isEqualTo(BookingStep.DATE_TIME);
        assertThat(t.draft().getBranchId()).isNull();
    }

    @Test
    @DisplayName("Should still cancel on an optional step when the booking itself is declined")
    void shouldCancelWhenBookingDeclinedOnOptionalStep() {
        BookingDraft draft = at(BookingStep.DATE_TIME).toBuilder().serviceId("S01").build();

        BookingTransition t = machine.advance(draft, "خلاص ما ابي احجز", snapshot);

        assertThat(t.outcome()).isEqualTo(Outcome.CANCELLED);
    }

    @Test
    @DisplayName("Should refuse to advance a finished booking")
    void shouldRejectTerminalDraft() {
        assertThatThrownBy(() -> machine.advance(at(BookingStep.DONE), "hello", snapshot))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should strip common name prefixes")
    void shouldExtractName() {
        assertThat(BookingStateMachine.extractName("I'm  Sara   Ahmed")).contains("Sara Ahmed");
        assertThat(BookingStateMachine.extractName("اسمي محمد")).contains("محمد");
        assertThat(BookingStateMachine.extractName("one two three four five")).isEmpty();
    }

    private BookingDraft step(BookingDraft draft, String text, Outcome expected) {
        BookingTransition t = machine.advance(draft, text, snapshot);
        assertThat(t.outcome()).as("outcome for '%s'", text).isEqualTo(expected);
        return t.draft();
    }
}
