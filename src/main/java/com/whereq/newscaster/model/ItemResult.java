package com.whereq.newscaster.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Stage chain outcome for one work item. Partial results survive a failed stage.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ItemResult {

    private String itemId;

    private String title;

    @Builder.Default
    private ItemOutcome outcome = ItemOutcome.SUCCEEDED;

    /**
     * Stage results in execution order
     */
    @Builder.Default
    private List<StageResult> stages = new ArrayList<>();

    /**
     * Name of the stage that stopped the chain
     */
    private String failedStage;

    private JobError error;

    public boolean isSucceeded() {
        return outcome == ItemOutcome.SUCCEEDED;
    }

    public Optional<StageResult> stage(String name) {
        return stages.stream().filter(s -> name.equals(s.getStage())).findFirst();
    }

    public enum ItemOutcome {
        SUCCEEDED,
        FAILED,
        /**
         * Batch was canceled before or while the item ran
         */
        CANCELED
    }
}
