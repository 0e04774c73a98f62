package com.ai.clinicdesk.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Day-level presence override for a doctor. Absence of a row means nothing is known for that day.
 */
@Entity
@Table(name = "doctor_availability",
        uniqueConstraints = @UniqueConstraint(columnNames = {"available_date", "doctor_id"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DoctorAvailability {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "available_date", nullable = false)
    private LocalDate date;

    @Column(name = "doctor_id", nullable = false, length = 20)
    private String doctorId;

    @Column(name = "branch_id", length = 20)
    private String branchId;

    @Column(nullable = false)
    private boolean available;

    @Column(length = 255)
    private String note;

    @Column(name = "last_updated")
    private Instant lastUpdated;
}
