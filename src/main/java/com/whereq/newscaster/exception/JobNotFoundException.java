package com.whereq.newscaster.exception;

import com.whereq.newscaster.model.ErrorKind;

/**
 * Job id unknown to the remote service or to the job store
 */
public class JobNotFoundException extends RenderJobException {
    public JobNotFoundException(String jobId) {
        super(ErrorKind.NOT_FOUND, "Job not found: " + jobId);
        withJobId(jobId);
    }
}
