package com.ai.clinicdesk.service;

import com.ai.clinicdesk.dto.ReferenceSnapshot;
import com.ai.clinicdesk.dto.ReferenceSnapshot.AvailabilityInfo;
import com.ai.clinicdesk.dto.ReferenceSnapshot.BranchInfo;
import com.ai.clinicdesk.dto.ReferenceSnapshot.DoctorInfo;
import com.ai.clinicdesk.dto.ReferenceSnapshot.ServiceInfo;
import com.ai.clinicdesk.entity.Branch;
import com.ai.clinicdesk.entity.ClinicService;
import com.ai.clinicdesk.entity.Doctor;
import com.ai.clinicdesk.entity.DoctorAvailability;
import com.ai.clinicdesk.repository.BranchRepository;
import com.ai.clinicdesk.repository.ClinicServiceRepository;
import com.ai.clinicdesk.repository.DoctorAvailabilityRepository;
import com.ai.clinicdesk.repository.DoctorRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the current {@link ReferenceSnapshot}. A refresh builds a complete new snapshot and
 * swaps it in atomically, so readers see either the old or the new data, never a mix.
 * A failed refresh keeps serving the previous snapshot.
 */
@Service
public class ReferenceDataProvider {

    private static final Logger log = LoggerFactory.getLogger(ReferenceDataProvider.class);

    private static final Map<String, DayOfWeek> DAY_CODES = Map.of(
            "MON", DayOfWeek.MONDAY, "TUE", DayOfWeek.TUESDAY, "WED", DayOfWeek.WEDNESDAY,
            "THU", DayOfWeek.THURSDAY, "FRI", DayOfWeek.FRIDAY, "SAT", DayOfWeek.SATURDAY,
            "SUN", DayOfWeek.SUNDAY);

    private final DoctorRepository doctorRepository;
    private final BranchRepository branchRepository;
    private final ClinicServiceRepository serviceRepository;
    private final DoctorAvailabilityRepository availabilityRepository;
    private final Clock clock;

    private final AtomicReference<ReferenceSnapshot> current = new AtomicReference<>();

    public ReferenceDataProvider(DoctorRepository doctorRepository,
                                 BranchRepository branchRepository,
                                 ClinicServiceRepository serviceRepository,
                                 DoctorAvailabilityRepository availabilityRepository,
                                 Clock clock) {
        this.doctorRepository = doctorRepository;
        this.branchRepository = branchRepository;
        this.serviceRepository = serviceRepository;
        this.availabilityRepository = availabilityRepository;
        this.clock = clock;
    }

    public Optional<ReferenceSnapshot> current() {
        return Optional.ofNullable(current.get());
    }

    public boolean isAvailable() {
        return current.get() != null;
    }

    @EventListener(ApplicationReadyEvent.class)
    @Order(2)
    public void loadOnStartup() {
        refresh();
    }

    @Scheduled(fixedDelayString = "${clinicdesk.reference.refresh-interval-ms:3600000}",
            initialDelayString = "${clinicdesk.reference.refresh-interval-ms:3600000}")
    @Transactional(readOnly = true)
    public boolean refresh() {
        try {
            ReferenceSnapshot next = load();
            current.set(next);
            log.info("Reference data refreshed: doctors={}, branches={}, services={}, availability={}",
                    next.doctors().size(), next.branches().size(), next.services().size(), next.availabilityCount());
            return true;
        } catch (RuntimeException ex) {
            log.warn("Reference data refresh failed, keeping previous snapshot (loaded={})", isAvailable(), ex);
            return false;
        }
    }

    /** Replaces the snapshot directly. Used when data comes from somewhere other than the database. */
    public void replace(ReferenceSnapshot snapshot) {
        current.set(snapshot);
    }

    private ReferenceSnapshot load() {
        List<DoctorInfo> doctors = doctorRepository.findByActiveTrueOrderById().stream()
                .map(ReferenceDataProvider::toInfo)
                .toList();
        List<BranchInfo> branches = branchRepository.findAll().stream()
                .map(ReferenceDataProvider::toInfo)
                .toList();
        List<ServiceInfo> services = serviceRepository.findAll().stream()
                .map(ReferenceDataProvider::toInfo)
                .toList();
        List<AvailabilityInfo> availability = availabilityRepository
                .findByDateGreaterThanEqual(LocalDate.now(clock).minusDays(1)).stream()
                .map(ReferenceDataProvider::toInfo)
                .toList();
        return ReferenceSnapshot.of(doctors, branches, services, availability, clock.instant());
    }

    private static DoctorInfo toInfo(Doctor d) {
        return new DoctorInfo(d.getId(), d.getName(), d.getSpecialty(), d.getBranchId(), parseDays(d.getDays()),
                d.getTimeFrom(), d.getTimeTo(), d.getPhone(), d.getEmail(), d.getExperienceYears(),
                d.getQualifications(), d.getNotes());
    }

    private static BranchInfo toInfo(Branch b) {
        return new BranchInfo(b.getId(), b.getName(), b.getAddress(), b.getCity(), b.getPhone(), b.getEmail(),
                b.getHoursWeekdays(), b.getHoursWeekend(), b.getMapsUrl(), b.getFeatures(),
                b.getParking(), b.getAccessibility());
    }

    private static ServiceInfo toInfo(ClinicService s) {
        List<String> branchIds = StringUtils.isBlank(s.getAvailableBranchIds())
                ? List.of()
                : Arrays.stream(s.getAvailableBranchIds().split(",")).map(String::trim).filter(StringUtils::isNotEmpty).toList();
        return new ServiceInfo(s.getId(), s.getName(), s.getSpecialty(), s.getDescription(), s.getPriceSar(),
                s.getPriceRange(), branchIds, s.getDurationMinutes(), s.getPreparationRequired(), s.isPopular());
    }

    private static AvailabilityInfo toInfo(DoctorAvailability a) {
        return new AvailabilityInfo(a.getDate(), a.getDoctorId(), a.getBranchId(), a.isAvailable(),
                a.getNote(), a.getLastUpdated());
    }

    static Set<DayOfWeek> parseDays(String days) {
        Set<DayOfWeek> out = EnumSet.noneOf(DayOfWeek.class);
        if (StringUtils.isBlank(days)) return out;
        for (String code : days.split(",")) {
            DayOfWeek d = DAY_CODES.get(StringUtils.left(code.trim().toUpperCase(), 3));
            if (d != null) out.add(d);
        }
        return out;
    }
}
