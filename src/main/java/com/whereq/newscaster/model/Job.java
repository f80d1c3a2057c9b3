package com.whereq.newscaster.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One submitted unit of asynchronous remote rendering work.
 * This is also the persisted record format of the job store.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Job {

    /**
     * Identifier assigned by the remote service
     */
    private String id;

    /**
     * Kind of remote work
     */
    private JobKind kind;

    /**
     * Last known status
     */
    private JobStatus status;

    /**
     * Source media references, opaque to the job layer
     */
    @Builder.Default
    private List<RenderInput> inputs = new ArrayList<>();

    /**
     * Output reported by the remote service once COMPLETED
     */
    @JsonProperty("remote_output_url")
    private String remoteOutputUrl;

    /**
     * Stable copy of the output in our own storage
     */
    @JsonProperty("rehosted_url")
    private String rehostedUrl;

    /**
     * Error details for failure states
     */
    private JobError error;

    /**
     * Work item that submitted the job
     */
    @JsonProperty("item_id")
    private String itemId;

    /**
     * Pipeline stage that submitted the job
     */
    private String stage;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("last_checked")
    private Instant lastCheckedAt;

    /**
     * Number of status checks performed
     */
    private int attempts;

    /**
     * Last raw status payload returned by the remote service
     */
    private JsonNode data;

    /**
     * Create a freshly submitted job
     */
    public static Job submitted(String id, JobKind kind, List<RenderInput> inputs, Instant now) {
        return Job.builder()
            .id(id)
            .kind(kind)
            .status(JobStatus.SUBMITTED)
            .inputs(inputs != null ? new ArrayList<>(inputs) : new ArrayList<>())
            .createdAt(now)
            .attempts(0)
            .build();
    }

    /**
     * Copy of this job, safe to hand out while the original is guarded by a store lock
     */
    public Job copy() {
        return toBuilder()
            .inputs(inputs != null ? new ArrayList<>(inputs) : new ArrayList<>())
            .error(error != null ? error.toBuilder().build() : null)
            .data(data != null ? data.deepCopy() : null)
            .build();
    }

    /**
     * URL callers should use for the artifact: the rehosted copy when present
     */
    public String bestOutputUrl() {
        return rehostedUrl != null ? rehostedUrl : remoteOutputUrl;
    }
}
