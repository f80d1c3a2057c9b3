package com.whereq.newscaster.controller;

import com.whereq.newscaster.dto.BatchCancellationResponse;
import com.whereq.newscaster.dto.BatchStatusResponse;
import com.whereq.newscaster.dto.BatchSubmitRequest;
import com.whereq.newscaster.dto.BatchSubmitResponse;
import com.whereq.newscaster.exception.ValidationException;
import com.whereq.newscaster.pipeline.PipelineRun;
import com.whereq.newscaster.pipeline.PipelineRun.RunState;
import com.whereq.newscaster.service.BatchRunService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Instant;

/**
 * Controller for batch runs: submission, status and cancellation
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/batches")
@RequiredArgsConstructor
@Tag(name = "Batches", description = "Article batch processing")
public class BatchController {

    private final BatchRunService batchRunService;

    /**
     * Start processing a batch in the background
     *
     * @param request items to process
     * @return Mono with 202 Accepted response
     */
    @PostMapping
    @Operation(summary = "Submit batch", description = "Start processing articles; returns a run id to poll")
    public Mono<ResponseEntity<BatchSubmitResponse>> submitBatch(@Valid @RequestBody BatchSubmitRequest request) {
        log.info("Received batch submission with {} items", request.getItems().size());

        return Mono.fromCallable(() -> batchRunService.start(request.getItems()))
            .map(runId -> ResponseEntity
                .status(HttpStatus.ACCEPTED)
                .location(URI.create("/api/v1/batches/" + runId))
                .body(BatchSubmitResponse.builder()
                    .runId(runId)
                    .state(RunState.RUNNING)
                    .itemCount(request.getItems().size())
                    .submittedAt(Instant.now())
                    .build()))
            .onErrorResume(ValidationException.class, e -> {
                log.error("Validation error: {}", e.getMessage());
                return Mono.just(ResponseEntity
                    .badRequest()
                    .body(BatchSubmitResponse.error(e.getMessage())));
            })
            .onErrorResume(IllegalStateException.class, e -> {
                log.error("Batch rejected: {}", e.getMessage());
                return Mono.just(ResponseEntity
                    .status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(BatchSubmitResponse.error(e.getMessage())));
            });
    }

    @GetMapping("/{runId}")
    @Operation(summary = "Get batch status", description = "Run state and, once finished, per-item results")
    public Mono<ResponseEntity<BatchStatusResponse>> getBatch(@PathVariable String runId) {
        return Mono.justOrEmpty(batchRunService.get(runId))
            .map(run -> ResponseEntity.ok(BatchStatusResponse.from(run)))
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    /**
     * Cancel a batch
     *
     * @param runId run identifier
     * @return 202 when cancellation was requested, 404 for unknown runs, 409 for finished runs
     */
    @DeleteMapping("/{runId}")
    @Operation(summary = "Cancel batch", description = "Stop waiting on in-flight jobs and skip items not yet started")
    public Mono<ResponseEntity<BatchCancellationResponse>> cancelBatch(@PathVariable String runId) {
        log.info("Cancellation request for run {}", runId);

        return Mono.justOrEmpty(batchRunService.get(runId))
            .map(run -> {
                boolean canceled = batchRunService.cancel(runId);
                return ResponseEntity
                    .status(canceled ? HttpStatus.ACCEPTED : HttpStatus.CONFLICT)
                    .body(cancellationResponse(run, canceled));
            })
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    private BatchCancellationResponse cancellationResponse(PipelineRun run, boolean canceled) {
        return BatchCancellationResponse.builder()
            .runId(run.getRunId())
            .state(run.getState())
            .cancelledAt(canceled ? Instant.now() : null)
            .message(canceled ? "Cancellation requested" : "Run already finished as " + run.getState())
            .build();
    }
}
