package com.ai.clinicdesk.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

@Entity
@Table(name = "clinic_service")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ClinicService {

    @Id
    @Column(length = 20)
    private String id;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(length = 100)
    private String specialty;

    @Column(length = 500)
    private String description;

    @Column(name = "price_sar", precision = 10, scale = 2)
    private BigDecimal priceSar;

    /** Free-text range used when the price depends on the case, e.g. {@code 3500-6000}. */
    @Column(name = "price_range", length = 40)
    private String priceRange;

    /** Comma separated branch ids. */
    @Column(name = "available_branch_ids", length = 120)
    private String availableBranchIds;

    @Column(name = "duration_minutes")
    private Integer durationMinutes;

    @Column(name = "preparation_required", length = 255)
    private String preparationRequired;

    @Builder.Default
    @Column(nullable = false)
    private boolean popular = false;
}
