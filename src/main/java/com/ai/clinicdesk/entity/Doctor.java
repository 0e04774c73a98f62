package com.ai.clinicdesk.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "doctor")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Doctor {

    @Id
    @Column(length = 20)
    private String id;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(length = 100)
    private String specialty;

    @Column(name = "branch_id", length = 20)
    private String branchId;

    /** Comma separated day codes, e.g. {@code SUN,MON,TUE}. */
    @Column(length = 60)
    private String days;

    @Column(name = "time_from", length = 5)
    private String timeFrom;

    @Column(name = "time_to", length = 5)
    private String timeTo;

    @Column(length = 30)
    private String phone;

    @Column(length = 100)
    private String email;

    @Column(name = "experience_years")
    private Integer experienceYears;

    @Column(length = 255)
    private String qualifications;

    @Column(length = 500)
    private String notes;

    @Builder.Default
    @Column(nullable = false)
    private boolean active = true;
}
