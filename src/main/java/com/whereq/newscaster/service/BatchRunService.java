package com.whereq.newscaster.service;

import com.whereq.newscaster.config.NewscasterProperties;
import com.whereq.newscaster.exception.ValidationException;
import com.whereq.newscaster.model.BatchResult;
import com.whereq.newscaster.model.WorkItem;
import com.whereq.newscaster.pipeline.PipelineOrchestrator;
import com.whereq.newscaster.pipeline.PipelineRun;
import com.whereq.newscaster.pipeline.Stage;
import com.whereq.newscaster.polling.CancellationToken;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Starts batch runs in the background and keeps their state for inspection and cancellation
 */
@Slf4j
@Service
public class BatchRunService {

    private final PipelineOrchestrator orchestrator;
    private final List<Stage> stageChain;
    private final TaskExecutor batchExecutor;
    private final NewscasterProperties.PipelineConfig config;
    private final Clock clock;

    private final Map<String, PipelineRun> runs = new ConcurrentHashMap<>();

    public BatchRunService(PipelineOrchestrator orchestrator,
                           @Qualifier("stageChain") List<Stage> stageChain,
                           @Qualifier("batchExecutor") TaskExecutor batchExecutor,
                           NewscasterProperties properties,
                           Clock clock) {
        this.orchestrator = orchestrator;
        this.stageChain = stageChain;
        this.batchExecutor = batchExecutor;
        this.config = properties.getPipeline();
        this.clock = clock;
    }

    /**
     * Start processing a batch in the background
     *
     * @param items work items, processed in order
     * @return run id
     * @throws ValidationException when the batch is empty, too large or has duplicate ids
     */
    public String start(List<WorkItem> items) {
        validate(items);
        evictFinishedRuns();

        String runId = UUID.randomUUID().toString();
        CancellationToken token = CancellationToken.create();
        PipelineRun run = new PipelineRun(runId, items.size(), clock.instant(), token);
        runs.put(runId, run);

        List<WorkItem> batch = new ArrayList<>(items);
        try {
            batchExecutor.execute(() -> execute(run, batch));
        } catch (TaskRejectedException e) {
            runs.remove(runId);
            throw new IllegalStateException("Batch executor is saturated, try again later", e);
        }

        log.info("Started run {} with {} items", runId, items.size());
        return runId;
    }

    public Optional<PipelineRun> get(String runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    public Collection<PipelineRun> list() {
        return List.copyOf(runs.values());
    }

    /**
     * Request cancellation of a running batch. Items in flight stop at their
     * next wait; items not yet started are marked canceled.
     *
     * @return false when the run is unknown or already finished
     */
    public boolean cancel(String runId) {
        PipelineRun run = runs.get(runId);
        if (run == null || !run.isRunning()) {
            return false;
        }
        log.info("Canceling run {}", runId);
        run.getToken().cancel("Run " + runId + " canceled by request");
        return true;
    }

    /**
     * Drop finished runs older than the retention period, then the oldest
     * finished runs beyond the retained count. Running runs are never evicted.
     *
     * @return number of runs removed
     */
    @Scheduled(fixedDelayString = "${newscaster.pipeline.run-cleanup-interval:60000}")
    public int evictFinishedRuns() {
        Instant cutoff = clock.instant().minus(config.getRunRetention());
        int removed = 0;
        for (PipelineRun run : runs.values()) {
            if (!run.isRunning() && run.getFinishedAt().isBefore(cutoff) && runs.remove(run.getRunId(), run)) {
                removed++;
            }
        }

        List<PipelineRun> finished = runs.values().stream()
            .filter(run -> !run.isRunning())
            .sorted(Comparator.comparing(PipelineRun::getFinishedAt))
            .toList();
        int excess = finished.size() - Math.max(0, config.getMaxRetainedRuns());
        for (int i = 0; i < excess; i++) {
            if (runs.remove(finished.get(i).getRunId(), finished.get(i))) {
                removed++;
            }
        }

        if (removed > 0) {
            log.debug("Evicted {} finished runs", removed);
        }
        return removed;
    }

    private void execute(PipelineRun run, List<WorkItem> items) {
        try {
            BatchResult result = orchestrator.processBatch(run.getRunId(), items, stageChain,
                config.getInterItemDelay(), run.getToken());
            run.complete(result, clock.instant());
        } catch (RuntimeException e) {
            log.error("Run {} could not be processed: {}", run.getRunId(), e.getMessage(), e);
            run.fail(e.getMessage(), clock.instant());
        }
    }

    private void validate(List<WorkItem> items) {
        if (items == null || items.isEmpty()) {
            throw new ValidationException("Batch contains no items");
        }
        if (items.size() > config.getMaxBatchSize()) {
            throw new ValidationException("Batch of " + items.size() + " items exceeds the limit of "
                + config.getMaxBatchSize());
        }
        Set<String> ids = new HashSet<>();
        for (WorkItem item : items) {
            if (item == null || item.getId() == null || item.getId().isBlank()) {
                throw new ValidationException("Every work item requires an id");
            }
            if (!ids.add(item.getId())) {
                throw new ValidationException("Duplicate work item id: " + item.getId());
            }
        }
    }
}
