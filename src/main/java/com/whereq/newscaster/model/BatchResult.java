package com.whereq.newscaster.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Summary of one batch run
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchResult {

    private String runId;

    private int total;

    private int succeeded;

    private int failed;

    private int canceled;

    /**
     * Per-item detail in input order
     */
    @Builder.Default
    private List<ItemResult> items = new ArrayList<>();

    private Instant startedAt;

    private Instant finishedAt;

    public Optional<ItemResult> item(String itemId) {
        return items.stream().filter(i -> itemId.equals(i.getItemId())).findFirst();
    }

    /**
     * Build the summary counts from item results
     */
    public static BatchResult of(String runId, List<ItemResult> items, Instant startedAt, Instant finishedAt) {
        int succeeded = 0;
        int failed = 0;
        int canceled = 0;
        for (ItemResult item : items) {
            switch (item.getOutcome()) {
                case SUCCEEDED -> succeeded++;
                case FAILED -> failed++;
                case CANCELED -> canceled++;
            }
        }
        return BatchResult.builder()
            .runId(runId)
            .total(items.size())
            .succeeded(succeeded)
            .failed(failed)
            .canceled(canceled)
            .items(new ArrayList<>(items))
            .startedAt(startedAt)
            .finishedAt(finishedAt)
            .build();
    }
}
