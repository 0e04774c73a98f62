package com.ai.clinicdesk.dto;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read-only view of clinic reference data. Built once per refresh and never mutated; every
 * collection is ordered by id so anything rendered from it is deterministic.
 */
public final class ReferenceSnapshot {

    public record DoctorInfo(String id, String name, String specialty, String branchId,
                             Set<DayOfWeek> days, String timeFrom, String timeTo,
                             String phone, String email, Integer experienceYears,
                             String qualifications, String notes) {
    }

    public record BranchInfo(String id, String name, String address, String city, String phone,
                             String email, String hoursWeekdays, String hoursWeekend, String mapsUrl,
                             String features, Boolean parking, Boolean accessibility) {
    }

    public record ServiceInfo(String id, String name, String specialty, String description,
                              BigDecimal priceSar, String priceRange, List<String> branchIds,
                              Integer durationMinutes, String preparationRequired, boolean popular) {
    }

    public record AvailabilityInfo(LocalDate date, String doctorId, String branchId,
                                   boolean available, String note, Instant lastUpdated) {
    }

    public record AvailabilityKey(LocalDate date, String doctorId) {
    }

    private final Map<String, DoctorInfo> doctors;
    private final Map<String, BranchInfo> branches;
    private final Map<String, ServiceInfo> services;
    private final Map<AvailabilityKey, AvailabilityInfo> availability;
    private final Instant loadedAt;

    private ReferenceSnapshot(Map<String, DoctorInfo> doctors, Map<String, BranchInfo> branches,
                              Map<String, ServiceInfo> services,
                              Map<AvailabilityKey, AvailabilityInfo> availability, Instant loadedAt) {
        this.doctors = Collections.unmodifiableMap(doctors);
        this.branches = Collections.unmodifiableMap(branches);
        this.services = Collections.unmodifiableMap(services);
        this.availability = Collections.unmodifiableMap(availability);
        this.loadedAt = loadedAt;
    }

    public static ReferenceSnapshot of(Collection<DoctorInfo> doctors, Collection<BranchInfo> branches,
                                       Collection<ServiceInfo> services, Collection<AvailabilityInfo> availability,
                                       Instant loadedAt) {
        Map<AvailabilityKey, AvailabilityInfo> byKey = new LinkedHashMap<>();
        availability.stream()
                .sorted(Comparator.comparing(AvailabilityInfo::date).thenComparing(AvailabilityInfo::doctorId))
                .forEach(a -> byKey.put(new AvailabilityKey(a.date(), a.doctorId()), a));
        return new ReferenceSnapshot(
                indexById(doctors, DoctorInfo::id),
                indexById(branches, BranchInfo::id),
                indexById(services, ServiceInfo::id),
                byKey,
                loadedAt);
    }

    private static <T> Map<String, T> indexById(Collection<T> items, Function<T, String> id) {
        return items.stream()
                .sorted(Comparator.comparing(id))
                .collect(Collectors.toMap(id, Function.identity(), (a, b) -> a, LinkedHashMap::new));
    }

    public Optional<DoctorInfo> doctor(String id) {
        return Optional.ofNullable(id == null ? null : doctors.get(id));
    }

    public Optional<BranchInfo> branch(String id) {
        return Optional.ofNullable(id == null ? null : branches.get(id));
    }

    public Optional<ServiceInfo> service(String id) {
        return Optional.ofNullable(id == null ? null : services.get(id));
    }

    public Optional<AvailabilityInfo> availability(LocalDate date, String doctorId) {
        return Optional.ofNullable(availability.get(new AvailabilityKey(date, doctorId)));
    }

    public List<DoctorInfo> doctors() {
        return List.copyOf(doctors.values());
    }

    public List<BranchInfo> branches() {
        return List.copyOf(branches.values());
    }

    public List<ServiceInfo> services() {
        return List.copyOf(services.values());
    }

    public int availabilityCount() {
        return availability.size();
    }

    public Map<String, String> doctorNames() {
        return names(doctors, DoctorInfo::name);
    }

    public Map<String, String> branchNames() {
        return names(branches, BranchInfo::name);
    }

    public Map<String, String> serviceNames() {
        return names(services, ServiceInfo::name);
    }

    private static <T> Map<String, String> names(Map<String, T> items, Function<T, String> name) {
        Map<String, String> out = new LinkedHashMap<>();
        items.forEach((id, item) -> out.put(id, name.apply(item)));
        return out;
    }

    public Instant getLoadedAt() {
        return loadedAt;
    }

    /**
     * Plain-text summary used as grounding facts for generated replies.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append("BRANCHES:\n");
        for (BranchInfo b : branches.values()) {
            sb.append("- ").append(b.name());
            if (b.city() != null) sb.append(", ").append(b.city());
            if (b.address() != null) sb.append(", ").append(b.address());
            if (b.hoursWeekdays() != null) sb.append(", weekdays ").append(b.hoursWeekdays());
            if (b.hoursWeekend() != null) sb.append(", weekend ").append(b.hoursWeekend());
            if (b.phone() != null) sb.append(", phone ").append(b.phone());
            sb.append("\n");
        }
        sb.append("DOCTORS:\n");
        for (DoctorInfo d : doctors.values()) {
            sb.append("- ").append(d.name());
            if (d.specialty() != null) sb.append(", ").append(d.specialty());
            branch(d.branchId()).ifPresent(b -> sb.append(", ").append(b.name()));
            if (d.timeFrom() != null && d.timeTo() != null) {
                sb.append(", ").append(d.timeFrom()).append("-").append(d.timeTo());
            }
            sb.append("\n");
        }
        sb.append("SERVICES:\n");
        for (ServiceInfo s : services.values()) {
            sb.append("- ").append(s.name());
            if (s.priceSar() != null) sb.append(", ").append(s.priceSar().stripTrailingZeros().toPlainString()).append(" SAR");
            else if (s.priceRange() != null) sb.append(", ").append(s.priceRange()).append(" SAR");
            sb.append("\n");
        }
        return sb.toString();
    }

    public boolean isEmpty() {
        return doctors.isEmpty() && branches.isEmpty() && services.isEmpty();
    }
}
