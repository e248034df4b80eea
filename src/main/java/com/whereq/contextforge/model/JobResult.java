package com.whereq.contextforge.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Result of a completed job
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class JobResult {
    /**
     * Short human readable outcome
     */
    private String summary;

    /**
     * Structured result data produced by the handler
     */
    private JsonNode data;

    /**
     * Confidence reported by the AI service, if any
     */
    private Double confidence;

    /**
     * Tokens consumed by the AI service, if any
     */
    private Integer tokensUsed;

    /**
     * Execution time in milliseconds
     */
    private long executionTimeMs;

    /**
     * When the job completed
     */
    private Instant completedAt;

    public static JobResult empty() {
        return JobResult.builder().build();
    }
}
