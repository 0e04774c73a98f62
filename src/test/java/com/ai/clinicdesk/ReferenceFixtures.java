package com.ai.clinicdesk;

import com.ai.clinicdesk.dto.ReferenceSnapshot;
import com.ai.clinicdesk.dto.ReferenceSnapshot.AvailabilityInfo;
import com.ai.clinicdesk.dto.ReferenceSnapshot.BranchInfo;
import com.ai.clinicdesk.dto.ReferenceSnapshot.DoctorInfo;
import com.ai.clinicdesk.dto.ReferenceSnapshot.ServiceInfo;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.EnumSet;
import java.util.List;

import static java.time.DayOfWeek.*;

/**
 * Same clinic as the demo seed, built in memory for unit tests.
 * Today is Monday 2026-03-02 in Asia/Riyadh.
 */
public final class ReferenceFixtures {

    public static final ZoneId ZONE = ZoneId.of("Asia/Riyadh");
    public static final Instant NOW = Instant.parse("2026-03-02T07:00:00Z");
    public static final LocalDate TODAY = LocalDate.of(2026, 3, 2);

    private ReferenceFixtures() {
    }

    public static Clock clock() {
        return Clock.fixed(NOW, ZONE);
    }

    public static ReferenceSnapshot snapshot() {
        return snapshot(TODAY);
    }

    public static ReferenceSnapshot snapshot(LocalDate today) {
        List<BranchInfo> branches = List.of(
                new BranchInfo("B01", "Olaya Branch", "Olaya Street, Al Olaya", "Riyadh", "0112345678",
                        "olaya@clinic.example", "09:00-21:00", "16:00-21:00", null, null, true, true),
                new BranchInfo("B02", "Malqa Branch", "King Fahd Road, Al Malqa", "Riyadh", "0118765432",
                        "malqa@clinic.example", "10:00-22:00", null, null, null, true, false),
                new BranchInfo("B03", "Corniche Branch", "Corniche Road, Al Shati", "Jeddah", "0123456789",
                        "corniche@clinic.example", "09:00-21:00", "16:00-22:00", null, null, false, true));
        List<DoctorInfo> doctors = List.of(
                doctor("D01", "Dr. Sarah Al-Harbi", "Dentistry", "B01", EnumSet.of(SUNDAY, MONDAY, TUESDAY, WEDNESDAY, THURSDAY), "09:00", "17:00", 12),
                doctor("D02", "Dr. Khalid Al-Otaibi", "Dermatology", "B02", EnumSet.of(SUNDAY, TUESDAY, THURSDAY), "10:00", "18:00", 8),
                doctor("D03", "Dr. Ahmed Al-Zahrani", "Pediatrics", "B01", EnumSet.of(MONDAY, WEDNESDAY, SATURDAY), "09:00", "15:00", 15),
                doctor("D04", "Dr. Ahmed Al-Ghamdi", "Orthodontics", "B03", EnumSet.of(SUNDAY, MONDAY, WEDNESDAY), "12:00", "20:00", 10),
                doctor("D05", "Dr. Noura Al-Qahtani", "Dermatology", "B03", EnumSet.of(MONDAY, TUESDAY, THURSDAY), "09:00", "16:00", 6));
        List<ServiceInfo> services = List.of(
                service("S01", "Teeth Cleaning", "Dentistry", new BigDecimal("250"), null, List.of("B01", "B03"), 45),
                service("S02", "Teeth Whitening", "Dentistry", new BigDecimal("900"), null, List.of("B01"), 60),
                service("S03", "Dental Implant", "Dentistry", null, "3500-6000", List.of("B01", "B03"), 90),
                service("S04", "Laser Hair Removal", "Dermatology", new BigDecimal("400"), null, List.of("B02", "B03"), 30),
                service("S05", "Pediatric Checkup", "Pediatrics", new BigDecimal("200"), null, List.of("B01"), 30),
                service("S06", "Braces Consultation", "Orthodontics", new BigDecimal("150"), null, List.of("B03"), 30));
        List<AvailabilityInfo> availability = List.of(
                new AvailabilityInfo(today, "D01", "B01", true, "Back after 3pm", NOW),
                new AvailabilityInfo(today, "D02", "B02", false, "On leave today", NOW),
                new AvailabilityInfo(today.plusDays(1), "D01", "B01", true, null, NOW));
        return ReferenceSnapshot.of(doctors, branches, services, availability, NOW);
    }

    private static DoctorInfo doctor(String id, String name, String specialty, String branchId,
                                     EnumSet<DayOfWeek> days, String from, String to, int years) {
        return new DoctorInfo(id, name, specialty, branchId, days, from, to, null, null, years, null, null);
    }

    private static ServiceInfo service(String id, String name, String specialty, BigDecimal price, String range,
                                       List<String> branches, int minutes) {
        return new ServiceInfo(id, name, specialty, null, price, range, branches, minutes, null, false);
    }
}
