package com.ai.clinicdesk.repository;

import com.ai.clinicdesk.entity.DoctorAvailability;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface DoctorAvailabilityRepository extends JpaRepository<DoctorAvailability, Long> {

    Optional<DoctorAvailability> findByDateAndDoctorId(LocalDate date, String doctorId);

    List<DoctorAvailability> findByDateGreaterThanEqual(LocalDate from);
}
