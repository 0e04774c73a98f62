package com.ai.clinicdesk.service;

import com.ai.clinicdesk.component.SessionLockRegistry;
import com.ai.clinicdesk.conversation.BookingStep;
import com.ai.clinicdesk.conversation.ClassificationResult;
import com.ai.clinicdesk.dto.BookingDraft;
import com.ai.clinicdesk.dto.BookingTransition;
import com.ai.clinicdesk.dto.BookingTransition.Outcome;
import com.ai.clinicdesk.dto.ReferenceSnapshot;
import com.ai.clinicdesk.entity.BookingSession;
import com.ai.clinicdesk.entity.BookingSession.CloseReason;
import com.ai.clinicdesk.entity.Reservation;
import com.ai.clinicdesk.exception.PersistenceFailureException;
import com.ai.clinicdesk.platform.Platform;
import com.ai.clinicdesk.repository.BookingSessionRepository;
import com.ai.clinicdesk.utils.UserIdMasker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Session store around {@link BookingStateMachine}: loads the active session, applies one
 * transition, and persists the result. Only a transition to DONE writes a reservation.
 */
@Service
public class BookingService {

    private static final Logger log = LoggerFactory.getLogger(BookingService.class);

    private final BookingSessionRepository sessionRepository;
    private final BookingStateMachine stateMachine;
    private final ReservationService reservationService;
    private final SessionLockRegistry locks;
    private final Clock clock;
    private final Duration inactivityTimeout;

    public BookingService(BookingSessionRepository sessionRepository,
                          BookingStateMachine stateMachine,
                          ReservationService reservationService,
                          SessionLockRegistry locks,
                          Clock clock,
                          @Value("${clinicdesk.booking.inactivity-timeout:30m}") Duration inactivityTimeout) {
        this.sessionRepository = sessionRepository;
        this.stateMachine = stateMachine;
        this.reservationService = reservationService;
        this.locks = locks;
        this.clock = clock;
        this.inactivityTimeout = inactivityTimeout;
    }

    /**
     * Active session for the user. A session idle past the inactivity timeout is closed here
     * and not returned.
     */
    @Transactional
    public Optional<BookingSession> findActive(Platform platform, String userId) {
        Optional<BookingSession> found = sessionRepository.findFirstByPlatformAndUserIdAndActiveTrueOrderByIdDesc(platform, userId);
        if (found.isPresent() && isExpired(found.get())) {
            close(found.get(), CloseReason.TIMED_OUT);
            save(found.get());
            log.info("Booking session {} timed out at step {}", found.get().getId(), found.get().getStep());
            return Optional.empty();
        }
        return found;
    }

    @Transactional
    public BookingTransition start(Platform platform, String userId, ClassificationResult request) {
        BookingDraft draft = stateMachine.start(request);
        Instant now = clock.instant();
        BookingSession session = BookingSession.builder()
                .platform(platform)
                .userId(userId)
                .createdAt(now)
                .updatedAt(now)
                .build();
        session.apply(draft);
        save(session);
        log.info("Booking session {} started for {}:{} (service={}, branch={}, doctor={})",
                session.getId(), platform, UserIdMasker.mask(userId),
                draft.getServiceId(), draft.getBranchId(), draft.getDoctorId());
        return BookingTransition.of(draft, Outcome.STARTED);
    }

    /**
     * Applies one user message to the session. On DONE the reservation is created first and
     * only then is the session closed, so a failed write leaves the session at its last step.
     */
    @Transactional
    public BookingTransition advance(BookingSession session, String text, ReferenceSnapshot snapshot) {
        if (!session.isActive() || session.getReservationCode() != null) {
            return BookingTransition.of(session.toDraft(), Outcome.COMPLETED);
        }
        BookingStep from = session.getStep();
        BookingTransition transition = stateMachine.advance(session.toDraft(), text, snapshot);
        if (transition.outcome() == Outcome.AMBIGUOUS) {
            return transition;
        }

        if (transition.outcome() == Outcome.COMPLETED) {
            Reservation reservation = reservationService.createIdempotent(session, transition.draft());
            session.setReservationCode(reservation.getReferenceCode());
            close(session, CloseReason.COMPLETED);
        } else if (transition.outcome() == Outcome.CANCELLED) {
            close(session, CloseReason.CANCELLED_BY_USER);
        } else if (transition.outcome() == Outcome.ABANDONED) {
            close(session, CloseReason.TOO_MANY_INVALID);
        }
        session.apply(transition.draft());
        session.setUpdatedAt(clock.instant());
        save(session);

        log.info("Booking session {}: {} -> {} ({})", session.getId(), from, session.getStep(), transition.outcome());
        return transition;
    }

    /** Closes sessions nobody touched within the inactivity timeout. */
    @Scheduled(fixedDelayString = "${clinicdesk.booking.sweep-interval-ms:300000}",
            initialDelayString = "${clinicdesk.booking.sweep-interval-ms:300000}")
    public int sweepExpired() {
        Instant cutoff = clock.instant().minus(inactivityTimeout);
        List<BookingSession> stale = sessionRepository.findByActiveTrueAndUpdatedAtBefore(cutoff);
        int closed = 0;
        for (BookingSession candidate : stale) {
            boolean timedOut = locks.withLock(candidate.getPlatform(), candidate.getUserId(), () ->
                    sessionRepository.findById(candidate.getId())
                            .filter(s -> s.isActive() && isExpired(s))
                            .map(s -> {
                                close(s, CloseReason.TIMED_OUT);
                                save(s);
                                return true;
                            })
                            .orElse(false));
            if (timedOut) closed++;
        }
        if (closed > 0) {
            log.info("Closed {} idle booking session(s)", closed);
        }
        return closed;
    }

    private boolean isExpired(BookingSession session) {
        return session.getUpdatedAt().plus(inactivityTimeout).isBefore(clock.instant());
    }

    private void close(BookingSession session, CloseReason reason) {
        session.setActive(false);
        session.setCloseReason(reason);
        if (reason == CloseReason.TIMED_OUT) {
            session.setStep(BookingStep.CANCELLED);
        }
        session.setUpdatedAt(clock.instant());
    }

    private void save(BookingSession session) {
        try {
            sessionRepository.saveAndFlush(session);
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Could not save booking session " + session.getId(), e);
        }
    }
}
