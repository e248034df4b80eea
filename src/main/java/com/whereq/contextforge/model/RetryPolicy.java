package com.whereq.contextforge.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Retry policy for failed jobs
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetryPolicy implements Serializable {
    private static final long serialVersionUID = 1L;

    /**
     * Default total execution budget for a job
     */
    @Builder.Default
    private int maxAttempts = 3;

    /**
     * Initial backoff interval in milliseconds
     */
    @Builder.Default
    private long initialIntervalMs = 2000;

    /**
     * Backoff multiplier
     */
    @Builder.Default
    private int backoffMultiplier = 2;

    /**
     * Maximum backoff interval in milliseconds
     */
    @Builder.Default
    private long maxIntervalMs = 60000;

    /**
     * Random spread applied to each delay, as a fraction of the delay (0.2 = ±20%)
     */
    @Builder.Default
    private double jitterFactor = 0.2;

    /**
     * Get default retry policy
     */
    public static RetryPolicy defaultPolicy() {
        return RetryPolicy.builder().build();
    }
}
