package com.whereq.newscaster.exception;

import com.whereq.newscaster.model.ErrorKind;
import com.whereq.newscaster.model.Job;

/**
 * Remote job ended in FAILED, REJECTED, CANCELED or TIMED_OUT
 */
public class RemoteJobFailureException extends RenderJobException {

    public RemoteJobFailureException(Job job) {
        super(ErrorKind.REMOTE_JOB_FAILURE, describe(job));
        withJob(job);
        withJobId(job.getId());
        withStage(job.getStage());
    }

    private static String describe(Job job) {
        String remote = job.getError() != null ? job.getError().getMessage() : null;
        return "Remote job " + job.getId() + " ended " + job.getStatus()
            + (remote != null ? ": " + remote : "");
    }
}
