package com.ai.clinicdesk.repository;

import com.ai.clinicdesk.entity.ClinicService;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ClinicServiceRepository extends JpaRepository<ClinicService, String> {
}
