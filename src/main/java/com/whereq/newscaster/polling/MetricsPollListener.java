package com.whereq.newscaster.polling;

import com.whereq.newscaster.exception.RenderJobException;
import com.whereq.newscaster.model.Job;
import com.whereq.newscaster.model.StatusPayload;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.time.Instant;

/**
 * Micrometer counters for polling activity
 */
public class MetricsPollListener implements PollListener {

    private final MeterRegistry meterRegistry;
    private final Counter statusChecks;
    private final Counter transientErrors;
    private final Counter pollingTimeouts;
    private final Counter canceled;
    private final Timer renderTime;

    public MetricsPollListener(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        statusChecks = Counter.builder("newscaster.jobs.status.checks")
            .description("Number of persisted status checks")
            .register(meterRegistry);

        transientErrors = Counter.builder("newscaster.jobs.status.transient.errors")
            .description("Number of retried status check failures")
            .register(meterRegistry);

        pollingTimeouts = Counter.builder("newscaster.jobs.polling.timeouts")
            .description("Number of jobs abandoned while still running remotely")
            .register(meterRegistry);

        canceled = Counter.builder("newscaster.jobs.polling.canceled")
            .description("Number of polling loops stopped by cancellation")
            .register(meterRegistry);

        renderTime = Timer.builder("newscaster.jobs.render.time")
            .description("Time from submission to terminal status")
            .register(meterRegistry);
    }

    @Override
    public void onStatus(Job job, StatusPayload payload) {
        statusChecks.increment();
    }

    @Override
    public void onTransientError(Job job, int attempt, int retry, RenderJobException error) {
        transientErrors.increment();
    }

    @Override
    public void onTerminal(Job job) {
        Counter.builder("newscaster.jobs.terminal")
            .description("Number of jobs reaching a terminal status")
            .tag("status", job.getStatus().name())
            .tag("kind", job.getKind() != null ? job.getKind().name() : "UNKNOWN")
            .register(meterRegistry)
            .increment();

        if (job.getCreatedAt() != null) {
            Instant end = job.getLastCheckedAt() != null ? job.getLastCheckedAt() : Instant.now();
            renderTime.record(Duration.between(job.getCreatedAt(), end));
        }
    }

    @Override
    public void onPollingTimeout(Job job) {
        pollingTimeouts.increment();
    }

    @Override
    public void onCanceled(Job job) {
        canceled.increment();
    }
}
