package com.whereq.contextforge.model.payload;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Payload for DEDUPLICATION jobs: the full candidate set plus a similarity threshold
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeduplicationPayload implements JobPayload {

    public static final double DEFAULT_THRESHOLD = 0.8;

    @NotBlank
    private String userId;

    /**
     * Collection the candidates were scoped to, if any
     */
    private String collectionId;

    @NotNull
    @Size(min = 2, message = "at least two items are required for duplicate detection")
    private List<@Valid @NotNull CandidateItem> items;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    @Builder.Default
    private double threshold = DEFAULT_THRESHOLD;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CandidateItem {
        @NotBlank
        private String id;

        private String name;

        @NotNull
        private String content;
    }
}
