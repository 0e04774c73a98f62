package com.ai.clinicdesk.controller;

import com.ai.clinicdesk.dto.ReferenceSnapshot;
import com.ai.clinicdesk.service.ReferenceDataProvider;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final ReferenceDataProvider referenceData;
    private final Clock clock;

    public HealthController(ReferenceDataProvider referenceData, Clock clock) {
        this.referenceData = referenceData;
        this.clock = clock;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        ReferenceSnapshot snapshot = referenceData.current().orElse(null);
        body.put("status", snapshot == null ? "degraded" : "ok");
        body.put("referenceData", snapshot != null);
        if (snapshot != null) {
            body.put("doctors", snapshot.doctors().size());
            body.put("branches", snapshot.branches().size());
            body.put("services", snapshot.services().size());
            body.put("availability", snapshot.availabilityCount());
            body.put("loadedAt", snapshot.getLoadedAt().toString());
            body.put("snapshotAgeSeconds", Duration.between(snapshot.getLoadedAt(), clock.instant()).getSeconds());
        }
        return body;
    }
}
