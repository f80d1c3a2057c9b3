package com.whereq.newscaster.dto;

import com.whereq.newscaster.model.WorkItem;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Request to process a batch of articles
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchSubmitRequest {
    /**
     * Items in processing order
     */
    @NotEmpty
    @Valid
    @Builder.Default
    private List<WorkItem> items = new ArrayList<>();
}
