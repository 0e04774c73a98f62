package com.ai.clinicdesk.entity;

import com.ai.clinicdesk.conversation.BookingStep;
import com.ai.clinicdesk.dto.BookingDraft;
import com.ai.clinicdesk.platform.Platform;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Persisted booking conversation. At most one active row per (platform, user); closed sessions
 * stay in the table with {@code active = false}.
 */
@Entity
@Table(name = "booking_session",
        indexes = @Index(name = "idx_booking_session_user", columnList = "platform, user_id, active"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BookingSession {

    public enum CloseReason { COMPLETED, CANCELLED_BY_USER, TOO_MANY_INVALID, TIMED_OUT }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Platform platform;

    @Column(name = "user_id", nullable = false, length = 100)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private BookingStep step;

    @Column(length = 60)
    private String name;

    @Column(length = 20)
    private String phone;

    @Column(name = "service_id", length = 20)
    private String serviceId;

    @Column(name = "branch_id", length = 20)
    private String branchId;

    @Column(name = "doctor_id", length = 20)
    private String doctorId;

    @Column(name = "preferred_date")
    private LocalDate preferredDate;

    @Column(name = "preferred_time")
    private LocalTime preferredTime;

    @Builder.Default
    @Column(name = "invalid_attempts", nullable = false)
    private int invalidAttempts = 0;

    @Column(name = "reservation_code", length = 60)
    private String reservationCode;

    @Builder.Default
    @Column(nullable = false)
    private boolean active = true;

    @Enumerated(EnumType.STRING)
    @Column(name = "close_reason", length = 30)
    private CloseReason closeReason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    public BookingDraft toDraft() {
        return BookingDraft.builder()
                .step(step)
                .name(name)
                .phone(phone)
                .serviceId(serviceId)
                .branchId(branchId)
                .doctorId(doctorId)
                .preferredDate(preferredDate)
                .preferredTime(preferredTime)
                .invalidAttempts(invalidAttempts)
                .build();
    }

    public void apply(BookingDraft draft) {
        this.step = draft.getStep();
        this.name = draft.getName();
        this.phone = draft.getPhone();
        this.serviceId = draft.getServiceId();
        this.branchId = draft.getBranchId();
        this.doctorId = draft.getDoctorId();
        this.preferredDate = draft.getPreferredDate();
        this.preferredTime = draft.getPreferredTime();
        this.invalidAttempts = draft.getInvalidAttempts();
    }
}
