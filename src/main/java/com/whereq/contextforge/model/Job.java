package com.whereq.contextforge.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.whereq.contextforge.model.payload.JobPayload;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Immutable snapshot of a job record.
 * Only the queue produces new snapshots; every state change replaces the stored instance.
 */
@Value
@Builder(toBuilder = true)
public class Job {
    /**
     * Unique job identifier, assigned at enqueue time
     */
    String id;

    JobType type;

    /**
     * Typed payload matching {@link #type}
     */
    JobPayload payload;

    JobPriority priority;

    JobStatus status;

    /**
     * Number of failed executions so far
     */
    int attempts;

    /**
     * Total execution budget
     */
    int maxAttempts;

    /**
     * 0-100, written only by the worker executing the job
     */
    int progress;

    /**
     * Owner of the job
     */
    String userId;

    JobResult result;

    String error;

    Instant createdAt;

    Instant startedAt;

    Instant completedAt;

    /**
     * Enqueue order, used to keep FIFO within a priority
     */
    @JsonIgnore
    long sequence;

    @JsonIgnore
    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }
}
