package com.whereq.contextforge.pipeline;

import com.whereq.contextforge.exception.ValidationException;
import com.whereq.contextforge.model.PipelineConfig;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Owner of the process-wide {@link PipelineConfig}.
 * Readers get an immutable snapshot; updates are merged by a single writer at a time.
 *
 * @author WhereQ Inc.
 */
@Slf4j
public class PipelineSettings {

    private final AtomicReference<PipelineConfig> current;

    public PipelineSettings(PipelineConfig initial) {
        validate(initial);
        this.current = new AtomicReference<>(initial);
    }

    public PipelineConfig snapshot() {
        return current.get();
    }

    /**
     * Merge the non-null fields of the update into the current configuration
     *
     * @return the new configuration
     * @throws ValidationException if the merged configuration is invalid
     */
    public synchronized PipelineConfig update(PipelineConfigUpdate update) {
        PipelineConfig base = current.get();
        if (update == null) {
            return base;
        }
        PipelineConfig.PipelineConfigBuilder builder = base.toBuilder();
        if (update.getEnableAutoClassification() != null) {
            builder.enableAutoClassification(update.getEnableAutoClassification());
        }
        if (update.getEnableAutoOptimization() != null) {
            builder.enableAutoOptimization(update.getEnableAutoOptimization());
        }
        if (update.getEnableDuplicateDetection() != null) {
            builder.enableDuplicateDetection(update.getEnableDuplicateDetection());
        }
        if (update.getEnableQualityAssessment() != null) {
            builder.enableQualityAssessment(update.getEnableQualityAssessment());
        }
        if (update.getBatchSize() != null) {
            builder.batchSize(update.getBatchSize());
        }
        if (update.getPriority() != null) {
            builder.priority(update.getPriority());
        }
        PipelineConfig merged = builder.build();
        validate(merged);
        current.set(merged);
        log.info("Pipeline configuration updated: {}", merged);
        return merged;
    }

    private static void validate(PipelineConfig config) {
        if (config.getBatchSize() < 1) {
            throw new ValidationException("batchSize must be at least 1, got " + config.getBatchSize());
        }
        if (config.getPriority() == null) {
            throw new ValidationException("priority is required");
        }
    }
}
