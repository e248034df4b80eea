package com.whereq.contextforge.worker;

import com.whereq.contextforge.model.JobType;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Map;

/**
 * Concurrency and timing of the worker pool
 */
@Value
@Builder
public class WorkerPoolSettings {

    @Builder.Default
    int defaultConcurrency = 2;

    /**
     * Per-type overrides of {@link #defaultConcurrency}
     */
    @Builder.Default
    Map<JobType, Integer> concurrency = Map.of();

    /**
     * Delay before an idle worker polls again
     */
    @Builder.Default
    Duration pollInterval = Duration.ofMillis(500);

    /**
     * Limit for a single execution; exceeding it counts as a retryable failure
     */
    @Builder.Default
    Duration executionTimeout = Duration.ofMinutes(5);

    public int concurrencyFor(JobType type) {
        Integer configured = concurrency != null ? concurrency.get(type) : null;
        return Math.max(1, configured != null ? configured : defaultConcurrency);
    }
}
