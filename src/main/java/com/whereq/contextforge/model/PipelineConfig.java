package com.whereq.contextforge.model;

import lombok.Builder;
import lombok.Value;

/**
 * Process-wide automation policy. Instances are immutable snapshots;
 * {@link com.whereq.contextforge.pipeline.PipelineSettings} owns the current one.
 */
@Value
@Builder(toBuilder = true)
public class PipelineConfig {

    @Builder.Default
    boolean enableAutoClassification = true;

    @Builder.Default
    boolean enableAutoOptimization = true;

    @Builder.Default
    boolean enableDuplicateDetection = true;

    @Builder.Default
    boolean enableQualityAssessment = true;

    /**
     * Items processed concurrently per chunk in batch mode
     */
    @Builder.Default
    int batchSize = 10;

    /**
     * Priority assigned to jobs created by the pipeline
     */
    @Builder.Default
    JobPriority priority = JobPriority.NORMAL;

    public static PipelineConfig defaults() {
        return PipelineConfig.builder().build();
    }
}
