package com.whereq.contextforge.pipeline;

import com.whereq.contextforge.exception.ValidationException;
import com.whereq.contextforge.model.JobPriority;
import com.whereq.contextforge.model.PipelineConfig;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PipelineSettingsTest {

    @Test
    void updateMergesOnlyProvidedFields() {
        PipelineSettings settings = new PipelineSettings(PipelineConfig.defaults());

        PipelineConfig updated = settings.update(PipelineConfigUpdate.builder()
            .enableAutoOptimization(false)
            .batchSize(25)
            .build());

        assertThat(updated.isEnableAutoOptimization()).isFalse();
        assertThat(updated.getBatchSize()).isEqualTo(25);
        assertThat(updated.isEnableAutoClassification()).isTrue();
        assertThat(updated.isEnableDuplicateDetection()).isTrue();
        assertThat(updated.isEnableQualityAssessment()).isTrue();
        assertThat(updated.getPriority()).isEqualTo(JobPriority.NORMAL);
        assertThat(settings.snapshot()).isEqualTo(updated);
    }

    @Test
    void snapshotsAreNotAffectedByLaterUpdates() {
        PipelineSettings settings = new PipelineSettings(PipelineConfig.defaults());
        PipelineConfig before = settings.snapshot();

        settings.update(PipelineConfigUpdate.builder().priority(JobPriority.URGENT).build());

        assertThat(before.getPriority()).isEqualTo(JobPriority.NORMAL);
        assertThat(settings.snapshot().getPriority()).isEqualTo(JobPriority.URGENT);
    }

    @Test
    void invalidBatchSizeLeavesConfigurationUnchanged() {
        PipelineSettings settings = new PipelineSettings(PipelineConfig.defaults());

        assertThatThrownBy(() -> settings.update(PipelineConfigUpdate.builder()
            .enableAutoClassification(false)
            .batchSize(0)
            .build()))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("batchSize");

        assertThat(settings.snapshot()).isEqualTo(PipelineConfig.defaults());
    }

    @Test
    void nullUpdateReturnsCurrentConfiguration() {
        PipelineSettings settings = new PipelineSettings(PipelineConfig.defaults());

        assertThat(settings.update(null)).isSameAs(settings.snapshot());
    }
}
