package com.whereq.contextforge.queue;

import com.whereq.contextforge.model.Job;
import com.whereq.contextforge.model.JobResult;
import com.whereq.contextforge.model.JobType;
import com.whereq.contextforge.model.payload.JobPayload;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Job queue interface for async job submission.
 * The queue is the only component allowed to change a job's lifecycle state.
 */
public interface JobQueue {

    /**
     * Enqueue a job with default options
     *
     * @param type job type
     * @param payload payload matching the type
     * @return job identifier
     */
    default String addJob(JobType type, JobPayload payload) {
        return addJob(type, payload, JobOptions.defaults());
    }

    /**
     * Enqueue a job
     *
     * @param type job type
     * @param payload payload matching the type
     * @param options priority and retry budget, may be null
     * @return job identifier
     * @throws com.whereq.contextforge.exception.ValidationException if the payload is malformed
     * @throws com.whereq.contextforge.exception.QuotaExceededException if the queue is full
     */
    String addJob(JobType type, JobPayload payload, JobOptions options);

    Optional<Job> getJobStatus(String jobId);

    OptionalInt getJobProgress(String jobId);

    /**
     * Jobs owned by a user, most recent first
     */
    List<Job> getUserJobs(String userId, int limit);

    /**
     * Cancel a job that has not started executing
     *
     * @param jobId job identifier
     * @return true if the job was PENDING or RETRY and is now CANCELLED
     */
    boolean cancelJob(String jobId);

    /**
     * Job counts by status for every job type
     */
    Map<JobType, QueueStats> getQueueStats();

    /**
     * Number of jobs waiting to run (PENDING or RETRY)
     */
    long size();

    /**
     * Atomically claim the next eligible job of a type: highest priority first, then oldest first.
     * Each pending job is handed to exactly one caller.
     *
     * @return the claimed job in PROCESSING state, empty if nothing is pending
     */
    Optional<Job> claimNext(JobType type);

    /**
     * Record progress for the execution identified by its attempt token.
     * Progress never decreases while the job is PROCESSING.
     *
     * @param attempt value of {@link Job#getAttempts()} when the job was claimed
     * @return true if the update was applied
     */
    boolean updateProgress(String jobId, int attempt, int progress);

    /**
     * Mark a claimed job as COMPLETED
     *
     * @return the completed job, empty if the claim is no longer current
     */
    Optional<Job> markCompleted(String jobId, int attempt, JobResult result);

    /**
     * Record a failed execution. The job moves to RETRY while attempts remain and the
     * error is retryable, otherwise to FAILED.
     *
     * @return the updated job, empty if the claim is no longer current
     */
    Optional<Job> markFailed(String jobId, int attempt, String error, boolean retryable);

    /**
     * Move a job from RETRY back to PENDING once its backoff elapsed
     *
     * @return true if the job is eligible for claiming again
     */
    boolean requeue(String jobId);

    /**
     * Move every job in RETRY back to PENDING without waiting for its backoff.
     * Used when workers start, since backoff timers do not survive a stop.
     *
     * @return number of requeued jobs
     */
    int requeueRetrying();

    /**
     * Drop finished jobs that completed before the cutoff
     *
     * @return number of removed jobs
     */
    int purgeTerminalJobs(Instant cutoff);
}
