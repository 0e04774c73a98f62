package com.ai.clinicdesk.repository;

import com.ai.clinicdesk.entity.Doctor;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface DoctorRepository extends JpaRepository<Doctor, String> {

    List<Doctor> findByActiveTrueOrderById();
}
