package com.whereq.contextforge.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Per-call options for processing items through the pipeline
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class OptimizationOptions {
    private String itemId;

    /**
     * Caller on whose behalf jobs are created, required
     */
    private String userId;

    private boolean forceReprocess;

    /**
     * Models to optimize for, all supported models when null or empty
     */
    private List<TargetModel> targetModels;

    private boolean skipIfOptimized;

    public List<TargetModel> effectiveTargetModels() {
        return targetModels == null || targetModels.isEmpty() ? TargetModel.defaults() : targetModels;
    }
}
