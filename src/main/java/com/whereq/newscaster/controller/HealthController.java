package com.whereq.newscaster.controller;

import com.whereq.newscaster.store.JobRecordStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.HashMap;
import java.util.Map;

/**
 * Health check controller to verify service and job store status.
 *
 * @author WhereQ Inc.
 */
@RestController
@RequestMapping("/api/v1/health")
@RequiredArgsConstructor
@Tag(name = "Health", description = "Service health check endpoints")
public class HealthController {

    private final JobRecordStore jobRecordStore;

    @GetMapping
    @Operation(summary = "Health check", description = "Check if the service and the job store are reachable")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return Mono.fromCallable(jobRecordStore::count)
                .subscribeOn(Schedulers.boundedElastic())
                .map(jobCount -> {
                    Map<String, Object> health = new HashMap<>();
                    health.put("status", "UP");
                    health.put("service", "whereq-newscaster");

                    Map<String, String> storeInfo = new HashMap<>();
                    storeInfo.put("type", jobRecordStore.getClass().getSimpleName());
                    storeInfo.put("status", "CONNECTED");
                    storeInfo.put("trackedJobs", String.valueOf(jobCount));

                    health.put("store", storeInfo);
                    return ResponseEntity.ok(health);
                })
                .onErrorResume(e -> {
                    Map<String, Object> health = new HashMap<>();
                    health.put("status", "UP");
                    health.put("service", "whereq-newscaster");

                    Map<String, String> storeInfo = new HashMap<>();
                    storeInfo.put("status", "ERROR");
                    storeInfo.put("error", e.getMessage());
                    health.put("store", storeInfo);

                    return Mono.just(ResponseEntity.ok(health));
                });
    }
}
