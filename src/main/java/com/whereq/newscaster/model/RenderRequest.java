package com.whereq.newscaster.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.whereq.newscaster.exception.ValidationException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rendering request submitted to the remote job service.
 * Serialized as the body of {@code POST /generate}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class RenderRequest {

    /**
     * Model and version, e.g. "lipsync-1.9.0-beta"
     */
    private String model;

    /**
     * Source media references
     */
    @Builder.Default
    private List<RenderInput> input = new ArrayList<>();

    /**
     * Output options (format, fps, resolution, ...)
     */
    @Builder.Default
    private Map<String, Object> options = new LinkedHashMap<>();

    /**
     * Kind of job this request creates, not sent to the service
     */
    @JsonIgnore
    @Builder.Default
    private JobKind kind = JobKind.VIDEO_RENDER;

    /**
     * Reject requests the remote service would refuse anyway
     *
     * @throws ValidationException when the request is malformed
     */
    public void validate() {
        if (model == null || model.isBlank()) {
            throw new ValidationException("Render request requires a model");
        }
        if (input == null || input.isEmpty()) {
            throw new ValidationException("Render request requires at least one input");
        }
        for (RenderInput ref : input) {
            if (ref == null || ref.getUrl() == null || ref.getUrl().isBlank()) {
                throw new ValidationException("Every render input requires a url");
            }
            if (ref.getType() == null || ref.getType().isBlank()) {
                throw new ValidationException("Every render input requires a type");
            }
        }
    }
}
