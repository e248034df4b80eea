package com.whereq.contextforge.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Job lifecycle states
 *
 * State transitions:
 * PENDING → PROCESSING → COMPLETED
 * PENDING → PROCESSING → RETRY → PENDING (while attempts &lt; maxAttempts)
 * PROCESSING → FAILED
 * PENDING | RETRY → CANCELLED
 */
public enum JobStatus {
    /**
     * Waiting to be claimed by a worker
     */
    PENDING,

    /**
     * Claimed by exactly one worker and executing
     */
    PROCESSING,

    /**
     * Completed successfully
     */
    COMPLETED,

    /**
     * Terminated with error, attempts exhausted or error not retryable
     */
    FAILED,

    /**
     * Waiting for the backoff delay before re-entering PENDING
     */
    RETRY,

    /**
     * User-initiated cancellation
     */
    CANCELLED;

    /**
     * Check if this is a terminal state
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Check if a cancel request can succeed from this state
     */
    public boolean isCancellable() {
        return this == PENDING || this == RETRY;
    }

    /**
     * Check if moving to the given state follows the lifecycle edges
     */
    public boolean canTransitionTo(JobStatus next) {
        return allowedTransitions().contains(next);
    }

    private Set<JobStatus> allowedTransitions() {
        return switch (this) {
            case PENDING -> EnumSet.of(PROCESSING, CANCELLED);
            case PROCESSING -> EnumSet.of(COMPLETED, FAILED, RETRY);
            case RETRY -> EnumSet.of(PENDING, CANCELLED);
            case COMPLETED, FAILED, CANCELLED -> EnumSet.noneOf(JobStatus.class);
        };
    }
}
