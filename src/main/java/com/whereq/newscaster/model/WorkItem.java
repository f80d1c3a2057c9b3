package com.whereq.newscaster.model;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One independent unit of a batch, typically a news article
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkItem {

    /**
     * Item identifier, unique within a batch
     */
    @NotBlank
    private String id;

    /**
     * Article title
     */
    private String title;

    /**
     * Article body or summary used to produce the script
     */
    private String content;

    /**
     * Source link, author and similar metadata
     */
    @Builder.Default
    private Map<String, String> attributes = new LinkedHashMap<>();
}
