package com.whereq.newscaster.exception;

import com.whereq.newscaster.model.ErrorKind;
import com.whereq.newscaster.model.Job;
import lombok.Getter;

/**
 * Caller canceled the wait. Carries the last known job, if any.
 */
@Getter
public class JobCanceledException extends RenderJobException {

    private final transient Job lastKnown;

    public JobCanceledException(String message, Job lastKnown) {
        super(ErrorKind.CANCELED, message);
        this.lastKnown = lastKnown;
        if (lastKnown != null) {
            withJob(lastKnown);
            withJobId(lastKnown.getId());
            withStage(lastKnown.getStage());
        }
    }
}
