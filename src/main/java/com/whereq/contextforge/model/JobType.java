package com.whereq.contextforge.model;

import com.whereq.contextforge.model.payload.BatchImportPayload;
import com.whereq.contextforge.model.payload.ClassificationPayload;
import com.whereq.contextforge.model.payload.DeduplicationPayload;
import com.whereq.contextforge.model.payload.EmbeddingPayload;
import com.whereq.contextforge.model.payload.JobPayload;
import com.whereq.contextforge.model.payload.OptimizationPayload;
import com.whereq.contextforge.model.payload.QualityAssessmentPayload;
import com.whereq.contextforge.model.payload.SimilarityScoringPayload;

/**
 * Kinds of background work. Each type accepts exactly one payload class.
 */
public enum JobType {
    OPTIMIZATION(OptimizationPayload.class),
    CLASSIFICATION(ClassificationPayload.class),
    QUALITY_ASSESSMENT(QualityAssessmentPayload.class),
    DEDUPLICATION(DeduplicationPayload.class),
    SIMILARITY_SCORING(SimilarityScoringPayload.class),
    BATCH_IMPORT(BatchImportPayload.class),
    EMBEDDING(EmbeddingPayload.class);

    private final Class<? extends JobPayload> payloadClass;

    JobType(Class<? extends JobPayload> payloadClass) {
        this.payloadClass = payloadClass;
    }

    public Class<? extends JobPayload> getPayloadClass() {
        return payloadClass;
    }

    public boolean accepts(JobPayload payload) {
        return payloadClass.isInstance(payload);
    }
}
