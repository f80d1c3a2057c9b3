package com.whereq.newscaster.service;

import com.whereq.newscaster.config.NewscasterProperties;
import com.whereq.newscaster.exception.ValidationException;
import com.whereq.newscaster.model.ItemResult;
import com.whereq.newscaster.model.ItemResult.ItemOutcome;
import com.whereq.newscaster.model.StageResult;
import com.whereq.newscaster.model.WorkItem;
import com.whereq.newscaster.pipeline.PipelineOrchestrator;
import com.whereq.newscaster.pipeline.PipelineRun;
import com.whereq.newscaster.pipeline.PipelineRun.RunState;
import com.whereq.newscaster.pipeline.Stage;
import com.whereq.newscaster.pipeline.StageContext;
import com.whereq.newscaster.support.MutableClock;
import com.whereq.newscaster.support.RecordingSleeper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BatchRunServiceTest {

    private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
    private final RecordingSleeper sleeper = new RecordingSleeper();
    private final List<Runnable> queued = new ArrayList<>();

    private NewscasterProperties properties;
    private PipelineOrchestrator orchestrator;

    private final Stage script = new Stage() {
        @Override
        public String name() {
            return "script";
        }

        @Override
        public StageResult execute(WorkItem item, StageContext context) {
            return StageResult.success("script", item.getTitle());
        }
    };

    @BeforeEach
    void setUp() {
        properties = new NewscasterProperties();
        properties.getPipeline().setInterItemDelay(Duration.ofSeconds(15));
        properties.getPipeline().setMaxBatchSize(3);
        orchestrator = new PipelineOrchestrator(null, sleeper, clock);
    }

    private BatchRunService service(List<Stage> chain, TaskExecutor executor) {
        return new BatchRunService(orchestrator, chain, executor, properties, clock);
    }

    private static WorkItem item(String id) {
        return WorkItem.builder().id(id).title("Story " + id).content("Body").build();
    }

    @Test
    @DisplayName("Run is processed in the background and its result kept")
    void runCompletes() {
        // given
        BatchRunService service = service(List.of(script), new SyncTaskExecutor());

        // when
        String runId = service.start(List.of(item("a"), item("b")));

        // then
        PipelineRun run = service.get(runId).orElseThrow();
        assertThat(run.getState()).isEqualTo(RunState.COMPLETED);
        assertThat(run.getItemCount()).isEqualTo(2);
        assertThat(run.getResult().getSucceeded()).isEqualTo(2);
        assertThat(run.getFinishedAt()).isEqualTo(clock.instant());
        assertThat(sleeper.sleeps()).containsExactly(Duration.ofSeconds(15));
        assertThat(service.list()).extracting(PipelineRun::getRunId).containsExactly(runId);
    }

    @Test
    @DisplayName("Canceling a queued run marks every item canceled")
    void cancelBeforeStart() {
        // given
        BatchRunService service = service(List.of(script), queued::add);
        String runId = service.start(List.of(item("a"), item("b"), item("c")));

        // when
        boolean canceled = service.cancel(runId);
        queued.forEach(Runnable::run);

        // then
        assertThat(canceled).isTrue();
        PipelineRun run = service.get(runId).orElseThrow();
        assertThat(run.getState()).isEqualTo(RunState.CANCELED);
        assertThat(run.getResult().getItems()).extracting(ItemResult::getOutcome)
            .containsOnly(ItemOutcome.CANCELED);
        assertThat(service.cancel(runId)).isFalse();
    }

    @Test
    @DisplayName("Runs are canceled independently")
    void cancelIsPerRun() {
        // given
        BatchRunService service = service(List.of(script), queued::add);
        String first = service.start(List.of(item("a")));
        String second = service.start(List.of(item("b")));

        // when
        service.cancel(first);
        queued.forEach(Runnable::run);

        // then
        assertThat(service.get(first).orElseThrow().getState()).isEqualTo(RunState.CANCELED);
        assertThat(service.get(second).orElseThrow().getState()).isEqualTo(RunState.COMPLETED);
    }

    @Test
    @DisplayName("Unknown runs cannot be canceled")
    void cancelUnknown() {
        assertThat(service(List.of(script), new SyncTaskExecutor()).cancel("missing")).isFalse();
    }

    @Test
    @DisplayName("Unusable stage chain fails the run instead of the caller")
    void brokenChainFailsRun() {
        // given
        BatchRunService service = service(List.of(), new SyncTaskExecutor());

        // when
        String runId = service.start(List.of(item("a")));

        // then
        PipelineRun run = service.get(runId).orElseThrow();
        assertThat(run.getState()).isEqualTo(RunState.FAILED);
        assertThat(run.getError()).contains("empty");
    }

    @Test
    @DisplayName("Empty, oversized and ambiguous batches are rejected")
    void validation() {
        BatchRunService service = service(List.of(script), new SyncTaskExecutor());

        assertThatThrownBy(() -> service.start(List.of())).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.start(List.of(item("a"), item("b"), item("c"), item("d"))))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("limit of 3");
        assertThatThrownBy(() -> service.start(List.of(item("a"), item("a"))))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("Duplicate");
        assertThatThrownBy(() -> service.start(List.of(item(" "))))
            .isInstanceOf(ValidationException.class);
        assertThat(service.list()).isEmpty();
    }

    @Test
    @DisplayName("Saturated executor rejects the run without leaving state behind")
    void executorRejection() {
        // given
        BatchRunService service = service(List.of(script), task -> {
            throw new TaskRejectedException("queue full");
        });

        // when / then
        assertThatThrownBy(() -> service.start(List.of(item("a"))))
            .isInstanceOf(IllegalStateException.class);
        assertThat(service.list()).isEmpty();
    }

    @Test
    @DisplayName("Finished runs are evicted once the retention period has passed")
    void evictsExpiredRuns() {
        // given
        MutableClock moving = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        properties.getPipeline().setRunRetention(Duration.ofMinutes(30));
        BatchRunService service = new BatchRunService(orchestrator, List.of(script), queued::add,
            properties, moving);
        String finished = service.start(List.of(item("a")));
        String running = service.start(List.of(item("b")));
        queued.get(0).run();

        // when
        moving.advance(Duration.ofMinutes(29));
        int early = service.evictFinishedRuns();
        moving.advance(Duration.ofMinutes(2));
        int late = service.evictFinishedRuns();

        // then
        assertThat(early).isZero();
        assertThat(late).isEqualTo(1);
        assertThat(service.get(finished)).isEmpty();
        assertThat(service.get(running)).isPresent();
        assertThat(service.get(running).orElseThrow().isRunning()).isTrue();
    }

    @Test
    @DisplayName("Only the newest finished runs are kept beyond the retained count")
    void evictsOldestBeyondLimit() {
        // given
        MutableClock moving = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        properties.getPipeline().setMaxRetainedRuns(2);
        BatchRunService service = new BatchRunService(orchestrator, List.of(script), new SyncTaskExecutor(),
            properties, moving);
        List<String> runIds = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            runIds.add(service.start(List.of(item("item-" + i))));
            moving.advance(Duration.ofSeconds(1));
        }

        // when
        service.evictFinishedRuns();

        // then
        assertThat(service.list()).extracting(PipelineRun::getRunId)
            .containsExactlyInAnyOrder(runIds.get(3), runIds.get(4));
    }
}
