package com.whereq.newscaster.polling;

import com.whereq.newscaster.client.RenderJobClient;
import com.whereq.newscaster.exception.JobCanceledException;
import com.whereq.newscaster.exception.RenderJobException;
import com.whereq.newscaster.model.ErrorKind;
import com.whereq.newscaster.model.Job;
import com.whereq.newscaster.model.JobError;
import com.whereq.newscaster.model.JobStatus;
import com.whereq.newscaster.model.PollingPolicy;
import com.whereq.newscaster.model.StatusPayload;
import com.whereq.newscaster.store.JobRecordStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;

/**
 * Drives one job from its current state to a terminal status, a local polling
 * timeout, or cancellation. Every successful status check is persisted so the
 * job state is visible to out-of-band readers and survives restarts.
 */
@Slf4j
public class JobPoller {

    private final RenderJobClient client;
    private final JobRecordStore store;
    private final Sleeper sleeper;
    private final Clock clock;
    private final PollListener listener;

    public JobPoller(RenderJobClient client, JobRecordStore store, Sleeper sleeper,
                     Clock clock, PollListener listener) {
        this.client = client;
        this.store = store;
        this.sleeper = sleeper;
        this.clock = clock;
        this.listener = listener != null ? listener : new PollListener() { };
    }

    /**
     * Poll a stored job until it is done
     *
     * @param jobId job identifier, must already be in the store
     * @param policy interval and attempt budget
     * @param token cancellation signal, checked before every wait
     * @return the final job; status POLLING_TIMEOUT when the budget ran out
     * @throws JobCanceledException when canceled, carrying the last known job
     * @throws RenderJobException on fatal client errors (auth, not found, validation)
     */
    public Job run(String jobId, PollingPolicy policy, CancellationToken token) {
        policy.validate();
        if (policy.isIndefinite() && !token.isCancellable()) {
            throw new IllegalArgumentException("Indefinite polling of job " + jobId + " requires a cancellable token");
        }

        Job last = store.load(jobId);
        if (last.getStatus().isTerminal()) {
            log.debug("Job {} already {}, nothing to poll", jobId, last.getStatus());
            return last;
        }

        log.info("Polling job {} every {}s ({})", jobId, policy.getInterval().toSeconds(),
            policy.isIndefinite() ? "until done or canceled" : "max " + policy.getMaxAttempts() + " attempts");

        int attempts = 0;
        while (true) {
            checkCancelled(token, last);
            attempts++;

            StatusPayload payload;
            try {
                payload = fetchWithRetries(last, attempts, policy, token);
            } catch (RenderJobException e) {
                if (!e.isRetryable()) {
                    log.error("Polling job {} stopped on {}: {}", jobId, e.getKind(), e.getMessage());
                    throw stopped(e, last);
                }
                log.warn("Status check {} of job {} failed after {} retries: {}",
                    attempts, jobId, policy.getTransientRetries(), e.getMessage());
                if (!policy.allowsAnotherAttempt(attempts)) {
                    return pollingTimeout(last);
                }
                pause(policy.getInterval(), token, last);
                continue;
            }

            StatusPayload observed = payload;
            last = store.update(jobId, job -> apply(job, observed));
            listener.onStatus(last, observed);
            log.debug("Job {} status check {}: {} (remote '{}')", jobId, attempts, last.getStatus(), payload.getRawStatus());

            if (last.getStatus().isTerminal()) {
                log.info("Job {} finished {} after {} status checks", jobId, last.getStatus(), last.getAttempts());
                listener.onTerminal(last);
                return last;
            }
            if (!policy.allowsAnotherAttempt(attempts)) {
                return pollingTimeout(last);
            }
            pause(policy.getInterval(), token, last);
        }
    }

    /**
     * Single out-of-band status check, persisted like a polling attempt.
     * Safe to call while a poll loop runs for the same job; terminal jobs are returned as stored.
     */
    public Job refresh(String jobId, Duration timeout) {
        Job current = store.load(jobId);
        if (current.getStatus().isTerminal()) {
            return current;
        }
        StatusPayload payload;
        try {
            payload = client.fetchStatus(jobId, timeout);
        } catch (RenderJobException e) {
            throw e.withJobId(jobId).withStage(current.getStage());
        }
        StatusPayload observed = payload;
        Job updated = store.update(jobId, job -> apply(job, observed));
        listener.onStatus(updated, observed);
        log.info("Refreshed job {}: {}", jobId, updated.getStatus());
        if (updated.getStatus().isTerminal()) {
            listener.onTerminal(updated);
        }
        return updated;
    }

    /**
     * One polling attempt: transient failures are retried with backoff before
     * the attempt counts as used
     */
    private StatusPayload fetchWithRetries(Job last, int attempt, PollingPolicy policy, CancellationToken token) {
        for (int retry = 0; ; retry++) {
            try {
                return client.fetchStatus(last.getId(), policy.getPerCallTimeout());
            } catch (RenderJobException e) {
                if (!e.isRetryable() || retry >= policy.getTransientRetries()) {
                    throw e;
                }
                Duration backoff = policy.transientBackoff(retry);
                log.debug("Transient error on job {} attempt {} (retry {}/{} in {}ms): {}", last.getId(), attempt,
                    retry + 1, policy.getTransientRetries(), backoff.toMillis(), e.getMessage());
                listener.onTransientError(last, attempt, retry + 1, e);
                checkCancelled(token, last);
                pause(backoff, token, last);
            }
        }
    }

    private void apply(Job job, StatusPayload payload) {
        JobStatus status = payload.getStatus() != null ? payload.getStatus() : JobStatus.PROCESSING;
        job.setStatus(status);
        job.setAttempts(job.getAttempts() + 1);
        job.setLastCheckedAt(clock.instant());
        job.setData(payload.getRaw());

        if (status == JobStatus.COMPLETED && payload.getOutputUrl() != null) {
            job.setRemoteOutputUrl(payload.getOutputUrl());
        }
        if (status.isFailure()) {
            String message = payload.getError() != null ? payload.getError() : "Remote job ended " + status;
            job.setError(JobError.builder()
                .kind(ErrorKind.REMOTE_JOB_FAILURE)
                .message(message)
                .jobId(job.getId())
                .stage(job.getStage())
                .build());
        } else {
            job.setError(null);
        }
    }

    /**
     * Record a fatal polling error on the job and attach the updated record.
     * The status stays as last observed, the remote job may still be running.
     */
    private RenderJobException stopped(RenderJobException e, Job last) {
        e.withJobId(last.getId()).withStage(last.getStage());
        JobError error = e.toJobError();
        Job recorded;
        try {
            recorded = store.update(last.getId(), job -> job.setError(error));
        } catch (RuntimeException storeError) {
            log.warn("Could not record error on job {}: {}", last.getId(), storeError.getMessage());
            recorded = last;
        }
        return e.withJob(recorded);
    }

    private Job pollingTimeout(Job last) {
        // Reported to the caller only; the stored record stays re-pollable
        Job reported = last.copy();
        reported.setStatus(JobStatus.POLLING_TIMEOUT);
        log.warn("Gave up waiting for job {} (still {} remotely)", last.getId(), last.getStatus());
        listener.onPollingTimeout(reported);
        return reported;
    }

    private void pause(Duration duration, CancellationToken token, Job last) {
        try {
            if (!sleeper.sleep(duration, token)) {
                throw canceled(token, last);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw canceled(token, last);
        }
    }

    private void checkCancelled(CancellationToken token, Job last) {
        if (token.isCancelled()) {
            throw canceled(token, last);
        }
    }

    private JobCanceledException canceled(CancellationToken token, Job last) {
        String reason = token.getReason() != null ? token.getReason() : "interrupted";
        log.info("Polling job {} canceled: {}", last.getId(), reason);
        listener.onCanceled(last);
        return new JobCanceledException("Polling job " + last.getId() + " canceled: " + reason, last);
    }
}
