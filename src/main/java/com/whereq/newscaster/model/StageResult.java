package com.whereq.newscaster.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Outcome of one stage for one work item
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StageResult {

    /**
     * Stage name
     */
    private String stage;

    private boolean success;

    /**
     * Stage output: script text, audio URL or video URL
     */
    private Object output;

    /**
     * Remote job behind the stage, for asynchronous stages
     */
    private Job job;

    /**
     * Non-fatal problem, e.g. a failed rehost
     */
    private String warning;

    /**
     * Failure details when success is false
     */
    private JobError error;

    private Duration elapsed;

    public static StageResult success(String stage, Object output) {
        return StageResult.builder().stage(stage).success(true).output(output).build();
    }

    public static StageResult failure(String stage, ErrorKind kind, String message) {
        return StageResult.builder()
            .stage(stage)
            .success(false)
            .error(JobError.of(kind, message))
            .build();
    }

    /**
     * Output as the requested type, or null when absent or of another type
     */
    public <T> T outputAs(Class<T> type) {
        return type.isInstance(output) ? type.cast(output) : null;
    }
}
