package com.whereq.newscaster.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Structured error attached to a job or a stage result
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobError {

    private ErrorKind kind;

    private String message;

    /**
     * Remote job the error belongs to, once it was submitted
     */
    @JsonProperty("job_id")
    private String jobId;

    /**
     * Pipeline stage that raised the error
     */
    private String stage;

    public static JobError of(ErrorKind kind, String message) {
        return JobError.builder().kind(kind).message(message).build();
    }
}
