package com.whereq.newscaster.controller;

import com.whereq.newscaster.dto.JobStatusResponse;
import com.whereq.newscaster.polling.CancellationToken;
import com.whereq.newscaster.service.JobTrackingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Controller for inspecting, refreshing and resuming tracked render jobs.
 * Store and render service calls block, so they run on the bounded elastic scheduler.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/jobs")
@RequiredArgsConstructor
@Tag(name = "Jobs", description = "Tracked render jobs")
public class JobController {

    private final JobTrackingService jobTrackingService;

    @GetMapping
    @Operation(summary = "List jobs", description = "All tracked jobs, newest first")
    public Mono<ResponseEntity<List<JobStatusResponse>>> listJobs() {
        return Mono.fromCallable(() -> jobTrackingService.list().stream().map(JobStatusResponse::from).toList())
            .subscribeOn(Schedulers.boundedElastic())
            .map(ResponseEntity::ok);
    }

    @GetMapping("/{jobId}")
    @Operation(summary = "Get job status", description = "Last persisted state of a job")
    public Mono<ResponseEntity<JobStatusResponse>> getJob(@PathVariable String jobId) {
        return Mono.fromCallable(() -> JobStatusResponse.from(jobTrackingService.get(jobId)))
            .subscribeOn(Schedulers.boundedElastic())
            .map(ResponseEntity::ok);
    }

    @PostMapping("/{jobId}/refresh")
    @Operation(summary = "Refresh job status", description = "Check the render service once and persist the result")
    public Mono<ResponseEntity<JobStatusResponse>> refreshJob(@PathVariable String jobId) {
        log.info("Refresh requested for job {}", jobId);
        return Mono.fromCallable(() -> JobStatusResponse.from(jobTrackingService.refresh(jobId)))
            .subscribeOn(Schedulers.boundedElastic())
            .map(ResponseEntity::ok);
    }

    /**
     * Keeps polling until the job settles. The wait is tied to the request:
     * when the client goes away the token is canceled and polling stops at its next wait.
     */
    @PostMapping("/{jobId}/resume")
    @Operation(summary = "Resume job", description = "Poll a job until it settles, e.g. after a polling timeout")
    public Mono<ResponseEntity<JobStatusResponse>> resumeJob(@PathVariable String jobId) {
        log.info("Resume requested for job {}", jobId);
        return Mono.defer(() -> {
            CancellationToken token = CancellationToken.create();
            return Mono.fromCallable(() -> JobStatusResponse.from(jobTrackingService.resume(jobId, token)))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnCancel(() -> token.cancel("Client disconnected while resuming job " + jobId));
        }).map(ResponseEntity::ok);
    }
}
