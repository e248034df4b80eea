package com.whereq.contextforge.pipeline;

import com.whereq.contextforge.model.JobPriority;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial pipeline configuration. Null fields keep their current value.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineConfigUpdate {
    private Boolean enableAutoClassification;
    private Boolean enableAutoOptimization;
    private Boolean enableDuplicateDetection;
    private Boolean enableQualityAssessment;
    private Integer batchSize;
    private JobPriority priority;
}
