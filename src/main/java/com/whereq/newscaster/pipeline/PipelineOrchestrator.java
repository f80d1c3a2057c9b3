package com.whereq.newscaster.pipeline;

import com.whereq.newscaster.exception.JobCanceledException;
import com.whereq.newscaster.exception.PipelineInitializationException;
import com.whereq.newscaster.exception.RenderJobException;
import com.whereq.newscaster.model.BatchResult;
import com.whereq.newscaster.model.ErrorKind;
import com.whereq.newscaster.model.ItemResult;
import com.whereq.newscaster.model.ItemResult.ItemOutcome;
import com.whereq.newscaster.model.JobError;
import com.whereq.newscaster.model.StageResult;
import com.whereq.newscaster.model.WorkItem;
import com.whereq.newscaster.polling.CancellationToken;
import com.whereq.newscaster.polling.Sleeper;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs a batch of independent work items through an ordered stage chain.
 * A failing item never affects the others; the batch always ends with a
 * summary instead of an exception.
 */
@Slf4j
public class PipelineOrchestrator {

    private final Executor itemExecutor;
    private final Sleeper sleeper;
    private final Clock clock;

    /**
     * @param itemExecutor pool running items concurrently, or null to run them on the calling thread
     */
    public PipelineOrchestrator(Executor itemExecutor, Sleeper sleeper, Clock clock) {
        this.itemExecutor = itemExecutor;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    public BatchResult processBatch(List<WorkItem> items, List<Stage> stages, Duration interItemDelay) {
        return processBatch(UUID.randomUUID().toString(), items, stages, interItemDelay, CancellationToken.none());
    }

    public BatchResult processBatch(List<WorkItem> items, List<Stage> stages, Duration interItemDelay,
                                    CancellationToken token) {
        return processBatch(UUID.randomUUID().toString(), items, stages, interItemDelay, token);
    }

    /**
     * Process all items. Item starts are spaced by {@code interItemDelay}; there
     * is no wait after the last item.
     *
     * @return per-item results in input order
     * @throws PipelineInitializationException when the stage chain is unusable
     */
    public BatchResult processBatch(String runId, List<WorkItem> items, List<Stage> stages,
                                    Duration interItemDelay, CancellationToken token) {
        validateChain(stages);
        List<WorkItem> batch = items != null ? items : List.of();
        CancellationToken cancel = token != null ? token : CancellationToken.none();
        Duration delay = interItemDelay != null && !interItemDelay.isNegative() ? interItemDelay : Duration.ZERO;

        Instant startedAt = clock.instant();
        log.info("Run {}: processing {} items through [{}]", runId, batch.size(), chainNames(stages));

        List<CompletableFuture<ItemResult>> pending = new ArrayList<>(batch.size());
        boolean interrupted = false;
        for (int i = 0; i < batch.size(); i++) {
            WorkItem item = batch.get(i);
            if (i > 0 && !interrupted) {
                interrupted = !waitBetweenItems(delay, cancel);
            }
            if (interrupted || cancel.isCancelled()) {
                log.debug("Run {}: item {} not started, batch canceled", runId, item.getId());
                pending.add(CompletableFuture.completedFuture(canceledItem(item, null)));
                continue;
            }
            pending.add(start(runId, item, stages, cancel));
        }

        List<ItemResult> results = new ArrayList<>(batch.size());
        for (int i = 0; i < pending.size(); i++) {
            results.add(collect(pending.get(i), batch.get(i)));
        }

        BatchResult result = BatchResult.of(runId, results, startedAt, clock.instant());
        log.info("Run {} finished: {} succeeded, {} failed, {} canceled of {}",
            runId, result.getSucceeded(), result.getFailed(), result.getCanceled(), result.getTotal());
        return result;
    }

    /**
     * Run the stage chain for one item, capturing every failure in the result
     */
    ItemResult processItem(String runId, WorkItem item, List<Stage> stages, CancellationToken token) {
        ItemResult result = ItemResult.builder()
            .itemId(item.getId())
            .title(item.getTitle())
            .build();

        if (item.getId() == null || item.getId().isBlank()) {
            return failed(result, stages.get(0).name(), JobError.of(ErrorKind.VALIDATION, "Work item has no id"));
        }

        StageContext context = new StageContext(runId, token);
        for (Stage stage : stages) {
            if (token.isCancelled()) {
                ItemResult canceled = canceledItem(item, result);
                if (!canceled.getStages().isEmpty()) {
                    canceled.setFailedStage(stage.name());
                }
                return canceled;
            }

            long started = System.nanoTime();
            StageResult stageResult;
            try {
                stageResult = stage.execute(item, context);
                if (stageResult == null) {
                    stageResult = StageResult.failure(stage.name(), ErrorKind.STAGE_FAILURE, "Stage returned no result");
                }
            } catch (JobCanceledException e) {
                log.info("Run {}: item {} canceled during stage {}", runId, item.getId(), stage.name());
                StageResult partial = StageResult.builder()
                    .stage(stage.name())
                    .success(false)
                    .job(e.getLastKnown())
                    .error(e.toJobError())
                    .build();
                result.getStages().add(partial);
                result.setOutcome(ItemOutcome.CANCELED);
                result.setFailedStage(stage.name());
                result.setError(e.toJobError());
                return result;
            } catch (RenderJobException e) {
                e.withStage(stage.name());
                log.warn("Run {}: item {} failed at stage {}: {}", runId, item.getId(), stage.name(), e.toString());
                stageResult = StageResult.builder()
                    .stage(stage.name())
                    .success(false)
                    .job(e.getJob())
                    .error(e.toJobError())
                    .build();
            } catch (RuntimeException e) {
                log.error("Run {}: item {} crashed at stage {}", runId, item.getId(), stage.name(), e);
                stageResult = StageResult.failure(stage.name(), ErrorKind.STAGE_FAILURE,
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
            stageResult.setElapsed(Duration.ofNanos(System.nanoTime() - started));

            result.getStages().add(stageResult);
            context.record(stageResult);
            if (!stageResult.isSuccess()) {
                return failed(result, stage.name(), stageResult.getError());
            }
            log.debug("Run {}: item {} stage {} done in {}ms", runId, item.getId(), stage.name(),
                stageResult.getElapsed().toMillis());
        }

        log.info("Run {}: item {} completed", runId, item.getId());
        return result;
    }

    private CompletableFuture<ItemResult> start(String runId, WorkItem item, List<Stage> stages, CancellationToken token) {
        if (itemExecutor == null) {
            return CompletableFuture.completedFuture(processItem(runId, item, stages, token));
        }
        try {
            return CompletableFuture.supplyAsync(() -> processItem(runId, item, stages, token), itemExecutor);
        } catch (RejectedExecutionException e) {
            log.error("Run {}: item {} rejected by the worker pool", runId, item.getId());
            ItemResult rejected = ItemResult.builder().itemId(item.getId()).title(item.getTitle()).build();
            return CompletableFuture.completedFuture(
                failed(rejected, stages.get(0).name(), JobError.of(ErrorKind.STAGE_FAILURE, "Worker pool rejected the item")));
        }
    }

    private ItemResult collect(CompletableFuture<ItemResult> future, WorkItem item) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Item {} ended abnormally", item.getId(), cause);
            ItemResult crashed = ItemResult.builder().itemId(item.getId()).title(item.getTitle()).build();
            crashed.setOutcome(ItemOutcome.FAILED);
            crashed.setError(JobError.of(ErrorKind.STAGE_FAILURE, String.valueOf(cause.getMessage())));
            return crashed;
        }
    }

    /**
     * @return false when the thread was interrupted
     */
    private boolean waitBetweenItems(Duration delay, CancellationToken token) {
        if (delay.isZero() || token.isCancelled()) {
            return true;
        }
        log.debug("Waiting {}s before next item", delay.toSeconds());
        try {
            sleeper.sleep(delay, token);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting between items, remaining items are not started");
            return false;
        }
    }

    private ItemResult canceledItem(WorkItem item, ItemResult partial) {
        ItemResult result = partial != null ? partial
            : ItemResult.builder().itemId(item.getId()).title(item.getTitle()).build();
        result.setOutcome(ItemOutcome.CANCELED);
        result.setError(JobError.of(ErrorKind.CANCELED, "Batch canceled"));
        return result;
    }

    private static ItemResult failed(ItemResult result, String stage, JobError error) {
        result.setOutcome(ItemOutcome.FAILED);
        result.setFailedStage(stage);
        result.setError(error);
        return result;
    }

    private static void validateChain(List<Stage> stages) {
        if (stages == null || stages.isEmpty()) {
            throw new PipelineInitializationException("Stage chain is empty");
        }
        Set<String> names = new HashSet<>();
        for (Stage stage : stages) {
            if (stage == null) {
                throw new PipelineInitializationException("Stage chain contains a missing stage");
            }
            if (!names.add(stage.name())) {
                throw new PipelineInitializationException("Duplicate stage name in chain: " + stage.name());
            }
        }
    }

    private static String chainNames(List<Stage> stages) {
        return String.join(" -> ", stages.stream().map(Stage::name).toList());
    }
}
