package com.whereq.newscaster.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Reference to source media for a render request (video template, audio track)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RenderInput {

    /**
     * Media type understood by the render service, e.g. "video" or "audio"
     */
    private String type;

    /**
     * Publicly reachable URL of the media
     */
    private String url;

    /**
     * Optional MIME type of the media
     */
    @JsonProperty("content_type")
    private String contentType;

    public static RenderInput video(String url) {
        return RenderInput.builder().type("video").url(url).build();
    }

    public static RenderInput audio(String url) {
        return RenderInput.builder().type("audio").url(url).build();
    }
}
