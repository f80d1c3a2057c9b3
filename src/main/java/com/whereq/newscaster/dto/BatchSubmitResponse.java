package com.whereq.newscaster.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.whereq.newscaster.pipeline.PipelineRun.RunState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response for batch submission
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BatchSubmitResponse {
    /**
     * Run identifier
     */
    private String runId;

    private RunState state;

    private int itemCount;

    private Instant submittedAt;

    /**
     * Error message (if submission failed)
     */
    private String errorMessage;

    public static BatchSubmitResponse error(String message) {
        return BatchSubmitResponse.builder()
            .state(RunState.FAILED)
            .errorMessage(message)
            .submittedAt(Instant.now())
            .build();
    }
}
