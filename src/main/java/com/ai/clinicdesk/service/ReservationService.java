package com.ai.clinicdesk.service;

import com.ai.clinicdesk.dto.BookingDraft;
import com.ai.clinicdesk.entity.BookingSession;
import com.ai.clinicdesk.entity.Reservation;
import com.ai.clinicdesk.exception.PersistenceFailureException;
import com.ai.clinicdesk.repository.ReservationRepository;
import com.ai.clinicdesk.utils.UserIdMasker;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

@Service
public class ReservationService {

    private static final Logger log = LoggerFactory.getLogger(ReservationService.class);

    private static final DateTimeFormatter CODE_TIME = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");
    private static final int USER_PREFIX_LENGTH = 6;

    private final ReservationRepository reservationRepository;
    private final Clock clock;

    public ReservationService(ReservationRepository reservationRepository, Clock clock) {
        this.reservationRepository = reservationRepository;
        this.clock = clock;
    }

    /**
     * Writes the reservation for a finished session. The session id is the idempotency key, so
     * calling this twice for the same session returns the first row.
     */
    @Transactional
    public Reservation createIdempotent(BookingSession session, BookingDraft draft) {
        String key = String.valueOf(session.getId());
        Optional<Reservation> existing = reservationRepository.findByIdempotencyKey(key);
        if (existing.isPresent()) {
            log.info("Reservation {} already exists for session {}", existing.get().getReferenceCode(), key);
            return existing.get();
        }

        Reservation reservation = Reservation.builder()
                .referenceCode(referenceCode(session.getUserId()))
                .idempotencyKey(key)
                .platform(session.getPlatform())
                .userId(session.getUserId())
                .name(draft.getName())
                .phone(draft.getPhone())
                .serviceId(draft.getServiceId())
                .branchId(draft.getBranchId())
                .doctorId(draft.getDoctorId())
                .requestedDate(draft.getPreferredDate())
                .requestedTime(draft.getPreferredTime())
                .status(Reservation.Status.PENDING)
                .createdAt(clock.instant())
                .build();
        try {
            reservation = reservationRepository.saveAndFlush(reservation);
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Could not save reservation for session " + key, e);
        }

        log.info("Reservation created: code={} platform={} user={} service={} branch={} date={}",
                reservation.getReferenceCode(), reservation.getPlatform(), UserIdMasker.mask(reservation.getUserId()),
                reservation.getServiceId(), reservation.getBranchId(), reservation.getRequestedDate());
        return reservation;
    }

    String referenceCode(String userId) {
        String prefix = StringUtils.left(userId.replaceAll("[^A-Za-z0-9]", ""), USER_PREFIX_LENGTH).toUpperCase();
        if (prefix.isEmpty()) prefix = "USER";
        return "BK-" + LocalDateTime.now(clock).format(CODE_TIME) + "-" + prefix;
    }
}
