package com.whereq.newscaster.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Parsed response of a status check
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class StatusPayload {

    private String jobId;

    /**
     * Status mapped onto {@link JobStatus}
     */
    private JobStatus status;

    /**
     * Status string exactly as reported
     */
    private String rawStatus;

    private String outputUrl;

    private String error;

    /**
     * Full response body
     */
    private JsonNode raw;
}
