package com.ai.clinicdesk.config;

import com.ai.clinicdesk.entity.Branch;
import com.ai.clinicdesk.entity.ClinicService;
import com.ai.clinicdesk.entity.Doctor;
import com.ai.clinicdesk.entity.DoctorAvailability;
import com.ai.clinicdesk.repository.BranchRepository;
import com.ai.clinicdesk.repository.ClinicServiceRepository;
import com.ai.clinicdesk.repository.DoctorAvailabilityRepository;
import com.ai.clinicdesk.repository.DoctorRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Demo reference data: three branches, five doctors, six services and day overrides for today and
 * tomorrow. Runs only when the doctor table is empty, before the reference snapshot is first loaded.
 */
@Component
public class DataInitializer {

    private static final Logger log = LoggerFactory.getLogger(DataInitializer.class);

    private final DoctorRepository doctorRepository;
    private final BranchRepository branchRepository;
    private final ClinicServiceRepository serviceRepository;
    private final DoctorAvailabilityRepository availabilityRepository;
    private final Clock clock;
    private final boolean enabled;

    public DataInitializer(DoctorRepository doctorRepository,
                           BranchRepository branchRepository,
                           ClinicServiceRepository serviceRepository,
                           DoctorAvailabilityRepository availabilityRepository,
                           Clock clock,
                           @Value("${clinicdesk.seed.enabled:true}") boolean enabled) {
        this.doctorRepository = doctorRepository;
        this.branchRepository = branchRepository;
        this.serviceRepository = serviceRepository;
        this.availabilityRepository = availabilityRepository;
        this.clock = clock;
        this.enabled = enabled;
    }

    @EventListener(ApplicationReadyEvent.class)
    @Order(1)
    @Transactional
    public void seed() {
        if (!enabled || doctorRepository.count() > 0) {
            return;
        }
        log.info("Seeding demo reference data...");

        branchRepository.saveAll(List.of(
                Branch.builder().id("B01").name("Olaya Branch").city("Riyadh").address("Olaya Street, Al Olaya")
                        .phone("0112345678").email("olaya@clinic.example").hoursWeekdays("09:00-21:00")
                        .hoursWeekend("16:00-21:00").parking(true).accessibility(true).build(),
                Branch.builder().id("B02").name("Malqa Branch").city("Riyadh").address("King Fahd Road, Al Malqa")
                        .phone("0118765432").email("malqa@clinic.example").hoursWeekdays("10:00-22:00")
                        .parking(true).accessibility(false).build(),
                Branch.builder().id("B03").name("Corniche Branch").city("Jeddah").address("Corniche Road, Al Shati")
                        .phone("0123456789").email("corniche@clinic.example").hoursWeekdays("09:00-21:00")
                        .hoursWeekend("16:00-22:00").parking(false).accessibility(true).build()));

        doctorRepository.saveAll(List.of(
                doctor("D01", "Dr. Sarah Al-Harbi", "Dentistry", "B01", "SUN,MON,TUE,WED,THU", "09:00", "17:00", 12),
                doctor("D02", "Dr. Khalid Al-Otaibi", "Dermatology", "B02", "SUN,TUE,THU", "10:00", "18:00", 8),
                doctor("D03", "Dr. Ahmed Al-Zahrani", "Pediatrics", "B01", "MON,WED,SAT", "09:00", "15:00", 15),
                doctor("D04", "Dr. Ahmed Al-Ghamdi", "Orthodontics", "B03", "SUN,MON,WED", "12:00", "20:00", 10),
                doctor("D05", "Dr. Noura Al-Qahtani", "Dermatology", "B03", "MON,TUE,THU", "09:00", "16:00", 6)));

        serviceRepository.saveAll(List.of(
                service("S01", "Teeth Cleaning", "Dentistry", new BigDecimal("250"), null, "B01,B03", 45, true),
                service("S02", "Teeth Whitening", "Dentistry", new BigDecimal("900"), null, "B01", 60, true),
                service("S03", "Dental Implant", "Dentistry", null, "3500-6000", "B01,B03", 90, false),
                service("S04", "Laser Hair Removal", "Dermatology", new BigDecimal("400"), null, "B02,B03", 30, true),
                service("S05", "Pediatric Checkup", "Pediatrics", new BigDecimal("200"), null, "B01", 30, false),
                service("S06", "Braces Consultation", "Orthodontics", new BigDecimal("150"), null, "B03", 30, false)));

        LocalDate today = LocalDate.now(clock);
        availabilityRepository.saveAll(List.of(
                availability(today, "D01", "B01", true, "Back after 3pm"),
                availability(today, "D02", "B02", false, "On leave today"),
                availability(today.plusDays(1), "D01", "B01", true, null)));

        log.info("DataInitializer: branches={}, doctors={}, services={}",
                branchRepository.count(), doctorRepository.count(), serviceRepository.count());
    }

    private static Doctor doctor(String id, String name, String specialty, String branchId, String days,
                                 String from, String to, int experience) {
        return Doctor.builder().id(id).name(name).specialty(specialty).branchId(branchId).days(days)
                .timeFrom(from).timeTo(to).experienceYears(experience).active(true).build();
    }

    private static ClinicService service(String id, String name, String specialty, BigDecimal price, String range,
                                         String branches, int minutes, boolean popular) {
        return ClinicService.builder().id(id).name(name).specialty(specialty).priceSar(price).priceRange(range)
                .availableBranchIds(branches).durationMinutes(minutes).popular(popular).build();
    }

    private DoctorAvailability availability(LocalDate date, String doctorId, String branchId, boolean available, String note) {
        return DoctorAvailability.builder().date(date).doctorId(doctorId).branchId(branchId)
                .available(available).note(note).lastUpdated(clock.instant()).build();
    }
}
