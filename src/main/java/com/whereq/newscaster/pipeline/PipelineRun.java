package com.whereq.newscaster.pipeline;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.whereq.newscaster.model.BatchResult;
import com.whereq.newscaster.polling.CancellationToken;
import lombok.Getter;

import java.time.Instant;

/**
 * State of one batch run. Each run owns its cancellation token, so canceling
 * one run never affects another.
 */
@Getter
public class PipelineRun {

    private final String runId;

    private final int itemCount;

    private final Instant startedAt;

    @JsonIgnore
    private final CancellationToken token;

    private volatile RunState state = RunState.RUNNING;

    private volatile Instant finishedAt;

    private volatile BatchResult result;

    private volatile String error;

    public PipelineRun(String runId, int itemCount, Instant startedAt, CancellationToken token) {
        this.runId = runId;
        this.itemCount = itemCount;
        this.startedAt = startedAt;
        this.token = token;
    }

    public boolean isRunning() {
        return state == RunState.RUNNING;
    }

    public void complete(BatchResult result, Instant finishedAt) {
        this.result = result;
        this.finishedAt = finishedAt;
        this.state = token.isCancelled() ? RunState.CANCELED : RunState.COMPLETED;
    }

    public void fail(String error, Instant finishedAt) {
        this.error = error;
        this.finishedAt = finishedAt;
        this.state = RunState.FAILED;
    }

    public enum RunState {
        RUNNING,
        COMPLETED,
        /**
         * Canceled on request; the result holds the items that did run
         */
        CANCELED,
        /**
         * Run could not start, e.g. an unusable stage chain
         */
        FAILED
    }
}
