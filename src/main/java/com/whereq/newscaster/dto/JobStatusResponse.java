package com.whereq.newscaster.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.whereq.newscaster.model.ErrorKind;
import com.whereq.newscaster.model.Job;
import com.whereq.newscaster.model.JobKind;
import com.whereq.newscaster.model.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response for job status query
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobStatusResponse {
    /**
     * Job identifier
     */
    private String jobId;

    private JobKind kind;

    /**
     * Current status
     */
    private JobStatus status;

    /**
     * Work item and stage that submitted the job
     */
    private String itemId;

    private String stage;

    /**
     * Rehosted URL when available, otherwise the remote one
     */
    private String outputUrl;

    private String remoteOutputUrl;

    private String rehostedUrl;

    /**
     * Number of status checks so far
     */
    private int attempts;

    private Instant createdAt;

    private Instant lastCheckedAt;

    /**
     * Error details (if failed)
     */
    private ErrorKind errorKind;

    private String errorMessage;

    public static JobStatusResponse from(Job job) {
        return JobStatusResponse.builder()
            .jobId(job.getId())
            .kind(job.getKind())
            .status(job.getStatus())
            .itemId(job.getItemId())
            .stage(job.getStage())
            .outputUrl(job.bestOutputUrl())
            .remoteOutputUrl(job.getRemoteOutputUrl())
            .rehostedUrl(job.getRehostedUrl())
            .attempts(job.getAttempts())
            .createdAt(job.getCreatedAt())
            .lastCheckedAt(job.getLastCheckedAt())
            .errorKind(job.getError() != null ? job.getError().getKind() : null)
            .errorMessage(job.getError() != null ? job.getError().getMessage() : null)
            .build();
    }
}
