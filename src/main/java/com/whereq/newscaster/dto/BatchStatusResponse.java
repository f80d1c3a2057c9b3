package com.whereq.newscaster.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.whereq.newscaster.model.BatchResult;
import com.whereq.newscaster.pipeline.PipelineRun;
import com.whereq.newscaster.pipeline.PipelineRun.RunState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response for batch status query
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BatchStatusResponse {

    private String runId;

    private RunState state;

    private int itemCount;

    private Instant startedAt;

    private Instant finishedAt;

    /**
     * Per-item results, once the run finished
     */
    private BatchResult result;

    private String errorMessage;

    public static BatchStatusResponse from(PipelineRun run) {
        return BatchStatusResponse.builder()
            .runId(run.getRunId())
            .state(run.getState())
            .itemCount(run.getItemCount())
            .startedAt(run.getStartedAt())
            .finishedAt(run.getFinishedAt())
            .result(run.getResult())
            .errorMessage(run.getError())
            .build();
    }
}
