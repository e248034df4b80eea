package com.whereq.contextforge.pipeline;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Aggregated outcome of a batch run. Every requested item is counted exactly once.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchResult {
    private int totalItems;

    private int processedItems;

    private int failedItems;

    /**
     * Jobs created across all items
     */
    @Builder.Default
    private List<String> jobIds = new ArrayList<>();

    @Builder.Default
    private List<ItemError> errors = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ItemError {
        private String itemId;
        private String message;
    }
}
