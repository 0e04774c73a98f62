package com.ai.clinicdesk.dto;

import com.ai.clinicdesk.conversation.BookingStep;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Immutable copy of the booking fields the state machine works on.
 */
@Value
@Builder(toBuilder = true)
public class BookingDraft {
    BookingStep step;
    String name;
    String phone;
    String serviceId;
    String branchId;
    String doctorId;
    LocalDate preferredDate;
    LocalTime preferredTime;
    int invalidAttempts;

    public static BookingDraft start() {
        return BookingDraft.builder().step(BookingStep.NAME).build();
    }
}
