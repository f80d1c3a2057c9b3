package com.whereq.newscaster.exception;

import com.whereq.newscaster.model.ErrorKind;
import com.whereq.newscaster.model.Job;
import com.whereq.newscaster.model.JobError;
import lombok.Getter;

/**
 * Base exception of the render job layer. Every instance carries its error kind
 * and, once known, the job id and the stage name for traceability.
 */
@Getter
public class RenderJobException extends RuntimeException {

    private final ErrorKind kind;

    private String jobId;

    private String stage;

    /**
     * Job record as known when the error was raised
     */
    private transient Job job;

    public RenderJobException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public RenderJobException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /**
     * Attach the job id unless one is already set
     */
    public RenderJobException withJobId(String jobId) {
        if (this.jobId == null) {
            this.jobId = jobId;
        }
        return this;
    }

    /**
     * Attach the stage name unless one is already set
     */
    public RenderJobException withStage(String stage) {
        if (this.stage == null) {
            this.stage = stage;
        }
        return this;
    }

    /**
     * Attach the job record unless one is already set
     */
    public RenderJobException withJob(Job job) {
        if (this.job == null) {
            this.job = job;
        }
        return this;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }

    public JobError toJobError() {
        return JobError.builder()
            .kind(kind)
            .message(getMessage())
            .jobId(jobId)
            .stage(stage)
            .build();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(getClass().getSimpleName())
            .append("[").append(kind);
        if (jobId != null) {
            sb.append(", job=").append(jobId);
        }
        if (stage != null) {
            sb.append(", stage=").append(stage);
        }
        return sb.append("]: ").append(getMessage()).toString();
    }
}
