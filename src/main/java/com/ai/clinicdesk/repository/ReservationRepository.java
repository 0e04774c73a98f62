package com.ai.clinicdesk.repository;

import com.ai.clinicdesk.entity.Reservation;
import com.ai.clinicdesk.platform.Platform;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface ReservationRepository extends JpaRepository<Reservation, Long> {

    Optional<Reservation> findByIdempotencyKey(String idempotencyKey);

    Optional<Reservation> findByReferenceCode(String referenceCode);

    List<Reservation> findByPlatformAndUserIdOrderByCreatedAtDesc(Platform platform, String userId);
}
