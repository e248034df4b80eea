package com.whereq.contextforge.store;

import com.whereq.contextforge.model.Job;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Holds job records and their lifecycle state
 */
public interface JobStore {

    /**
     * Insert a new job
     *
     * @param job the job to insert
     * @throws IllegalStateException if a job with the same id already exists
     */
    void insert(Job job);

    /**
     * Find a job by id
     *
     * @param jobId job identifier
     * @return current snapshot, empty if unknown
     */
    Optional<Job> findById(String jobId);

    /**
     * Atomically replace a job when the precondition holds on its current snapshot.
     * Terminal jobs are never replaced and the replacement must follow the lifecycle edges.
     *
     * @param jobId job identifier
     * @param precondition checked against the current snapshot
     * @param mutation produces the next snapshot
     * @return the stored snapshot, empty if the job is unknown or the precondition failed
     * @throws IllegalStateException if the mutation attempts an illegal status transition
     */
    Optional<Job> update(String jobId, Predicate<Job> precondition, UnaryOperator<Job> mutation);

    /**
     * Jobs owned by a user, most recent first
     */
    List<Job> findByUser(String userId, int limit);

    /**
     * Snapshot of all jobs
     */
    List<Job> findAll();

    /**
     * Remove terminal jobs that completed before the cutoff
     *
     * @return number of removed jobs
     */
    int removeTerminalBefore(Instant cutoff);
}
