package com.whereq.newscaster.dto;

import com.whereq.newscaster.pipeline.PipelineRun.RunState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response for batch cancellation
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchCancellationResponse {

    private String runId;

    /**
     * State when the request was handled; the run finishes as CANCELED once in-flight work stops
     */
    private RunState state;

    private Instant cancelledAt;

    private String message;
}
