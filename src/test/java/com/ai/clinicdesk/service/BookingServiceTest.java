package com.ai.clinicdesk.service;

import com.ai.clinicdesk.MutableClock;
import com.ai.clinicdesk.ReferenceFixtures;
import com.ai.clinicdesk.component.DateParser;
import com.ai.clinicdesk.component.ReferenceMatcher;
import com.ai.clinicdesk.component.SessionLockRegistry;
import com.ai.clinicdesk.conversation.BookingStep;
import com.ai.clinicdesk.dto.BookingTransition;
import com.ai.clinicdesk.dto.BookingTransition.Outcome;
import com.ai.clinicdesk.dto.ReferenceSnapshot;
import com.ai.clinicdesk.entity.BookingSession;
import com.ai.clinicdesk.entity.BookingSession.CloseReason;
import com.ai.clinicdesk.entity.Reservation;
import com.ai.clinicdesk.platform.Platform;
import com.ai.clinicdesk.repository.BookingSessionRepository;
import com.ai.clinicdesk.repository.ReservationRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Import({BookingService.class, ReservationService.class, BookingStateMachine.class, ReferenceMatcher.class,
        DateParser.class, SessionLockRegistry.class, BookingServiceTest.ClockConfiguration.class})
@DisplayName("BookingService Integration Tests")
class BookingServiceTest {

    @TestConfiguration
    static class ClockConfiguration {
        @Bean
        MutableClock clock() {
            return MutableClock.startingAtFixtureTime();
        }
    }

    private static final String USER = "966501234567";

    @Autowired
    private BookingService bookingService;

    @Autowired
    private ReservationService reservationService;

    @Autowired
    private BookingSessionRepository sessionRepository;

    @Autowired
    private ReservationRepository reservationRepository;

    @Autowired
    private MutableClock clock;

    private ReferenceSnapshot snapshot;

    @BeforeEach
    void setUp() {
        snapshot = ReferenceFixtures.snapshot();
    }

    @Test
    @DisplayName("Should create exactly one reservation when the booking completes")
    void shouldCompleteBooking() {
        // Given
        BookingSession session = startAndFill("Mohammed Ali", "0501234567", "1", "skip");

        // When
        BookingTransition done = bookingService.advance(session, "tomorrow 10am", snapshot);

        // Then
        assertThat(done.outcome()).isEqualTo(Outcome.COMPLETED);
        assertThat(session.isActive()).isFalse();
        assertThat(session.getCloseReason()).isEqualTo(CloseReason.COMPLETED);
        assertThat(session.getStep()).isEqualTo(BookingStep.DONE);
        assertThat(session.getReservationCode()).startsWith("BK-20260302100000-966501");

        Reservation reservation = reservationRepository.findByReferenceCode(session.getReservationCode()).orElseThrow();
        assertThat(reservation.getName()).isEqualTo("Mohammed Ali");
        assertThat(reservation.getServiceId()).isEqualTo("S01");
        assertThat(reservation.getBranchId()).isNull();
        assertThat(reservation.getRequestedDate()).isEqualTo(ReferenceFixtures.TODAY.plusDays(1));
        assertThat(reservation.getStatus()).isEqualTo(Reservation.Status.PENDING);
        assertThat(bookingService.findActive(Platform.WHATSAPP, USER)).isEmpty();
    }

    @Test
    @DisplayName("Should not write a second reservation when the final message is replayed")
    void shouldBeIdempotent() {
        BookingSession session = startAndFill("Mohammed Ali", "0501234567", "1", "skip");
        bookingService.advance(session, "skip", snapshot);
        String code = session.getReservationCode();

        BookingTransition replay = bookingService.advance(session, "skip", snapshot);

        assertThat(replay.outcome()).isEqualTo(Outcome.COMPLETED);
        assertThat(session.getReservationCode()).isEqualTo(code);
        assertThat(reservationRepository.count()).isEqualTo(1);
        assertThat(reservationService.createIdempotent(session, session.toDraft()).getReferenceCode()).isEqualTo(code);
        assertThat(reservationRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should close the session on cancel without a reservation")
    void shouldCancel() {
        BookingSession session = startAndFill("Mohammed Ali");

        BookingTransition t = bookingService.advance(session, "cancel", snapshot);

        assertThat(t.outcome()).isEqualTo(Outcome.CANCELLED);
        assertThat(session.isActive()).isFalse();
        assertThat(session.getCloseReason()).isEqualTo(CloseReason.CANCELLED_BY_USER);
        assertThat(reservationRepository.count()).isZero();
    }

    @Test
    @DisplayName("Should persist the attempt counter on invalid input")
    void shouldPersistInvalidAttempts() {
        BookingSession session = startAndFill("Mohammed Ali");

        bookingService.advance(session, "not a number", snapshot);

        BookingSession stored = sessionRepository.findById(session.getId()).orElseThrow();
        assertThat(stored.getStep()).isEqualTo(BookingStep.PHONE);
        assertThat(stored.getInvalidAttempts()).isEqualTo(1);
        assertThat(stored.isActive()).isTrue();
    }

    @Test
    @DisplayName("Should time out an idle session when it is next looked up")
    void shouldTimeOutOnLookup() {
        startAndFill("Mohammed Ali");

        clock.advance(Duration.ofMinutes(31));

        assertThat(bookingService.findActive(Platform.WHATSAPP, USER)).isEmpty();
        BookingSession closed = sessionRepository.findAll().get(0);
        assertThat(closed.getCloseReason()).isEqualTo(CloseReason.TIMED_OUT);
        assertThat(closed.getStep()).isEqualTo(BookingStep.CANCELLED);
    }

    @Test
    @DisplayName("Should sweep only sessions idle past the timeout")
    void shouldSweepIdleSessions() {
        startAndFill("Mohammed Ali");
        clock.advance(Duration.ofMinutes(20));
        bookingService.start(Platform.INSTAGRAM, "ig-42", null);

        clock.advance(Duration.ofMinutes(15));

        assertThat(bookingService.sweepExpired()).isEqualTo(1);
        assertThat(bookingService.findActive(Platform.WHATSAPP, USER)).isEmpty();
        assertThat(bookingService.findActive(Platform.INSTAGRAM, "ig-42")).isPresent();
    }

    private BookingSession startAndFill(String... answers) {
        BookingTransition started = bookingService.start(Platform.WHATSAPP, USER, null);
        assertThat(started.outcome()).isEqualTo(Outcome.STARTED);
        BookingSession session = bookingService.findActive(Platform.WHATSAPP, USER).orElseThrow();
        for (String answer : answers) {
            assertThat(bookingService.advance(session, answer, snapshot).outcome()).isEqualTo(Outcome.ADVANCED);
        }
        return session;
    }
}
