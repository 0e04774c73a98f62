package com.ai.clinicdesk.repository;

import com.ai.clinicdesk.entity.BookingSession;
import com.ai.clinicdesk.platform.Platform;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface BookingSessionRepository extends JpaRepository<BookingSession, Long> {

    Optional<BookingSession> findFirstByPlatformAndUserIdAndActiveTrueOrderByIdDesc(Platform platform, String userId);

    List<BookingSession> findByActiveTrueAndUpdatedAtBefore(Instant cutoff);
}
