package com.whereq.newscaster.exception;

import com.whereq.newscaster.model.ErrorKind;
import com.whereq.newscaster.model.Job;

/**
 * Polling budget exhausted while the remote job is still running.
 * The job stays re-pollable under the same id.
 */
public class PollingTimeoutException extends RenderJobException {

    public PollingTimeoutException(Job job) {
        super(ErrorKind.POLLING_TIMEOUT, "Stopped waiting for job " + job.getId()
            + " after " + job.getAttempts() + " status checks; it can be resumed later");
        withJob(job);
        withJobId(job.getId());
        withStage(job.getStage());
    }
}
