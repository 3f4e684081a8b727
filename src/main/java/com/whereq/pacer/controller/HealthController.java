package com.whereq.pacer.controller;

import com.whereq.pacer.model.JobStatus;
import com.whereq.pacer.store.JobStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Health check controller to verify the service and its job store.
 *
 * @author WhereQ Inc.
 */
@RestController
@RequestMapping("/api/v1/health")
@Tag(name = "Health", description = "Service health check endpoints")
public class HealthController {

    static final String SERVICE_NAME = "pacer";

    @Autowired
    private JobStore jobStore;

    @GetMapping
    @Operation(summary = "Health check", description = "Check if the service and its job store are running")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return jobStore.countByStatus()
                .map(counts -> {
                    Map<String, Object> health = new HashMap<>();
                    health.put("status", "UP");
                    health.put("service", SERVICE_NAME);

                    Map<String, Long> jobs = new HashMap<>();
                    counts.forEach((status, count) -> jobs.put(status.name().toLowerCase(Locale.ROOT), count));
                    for (JobStatus status : JobStatus.values()) {
                        jobs.putIfAbsent(status.name().toLowerCase(Locale.ROOT), 0L);
                    }

                    health.put("jobs", jobs);
                    return ResponseEntity.ok(health);
                })
                .onErrorResume(e -> {
                    Map<String, Object> health = new HashMap<>();
                    health.put("status", "UP");
                    health.put("service", SERVICE_NAME);

                    Map<String, String> storeInfo = new HashMap<>();
                    storeInfo.put("status", "ERROR");
                    storeInfo.put("error", e.getMessage());
                    health.put("jobStore", storeInfo);

                    return Mono.just(ResponseEntity.ok(health));
                });
    }
}
