package com.whereq.contextforge.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.whereq.contextforge.dto.CreateJobRequest;
import com.whereq.contextforge.dto.JobCancellationResponse;
import com.whereq.contextforge.dto.JobStatsResponse;
import com.whereq.contextforge.dto.JobStatusResponse;
import com.whereq.contextforge.dto.JobSubmitResponse;
import com.whereq.contextforge.exception.CancellationRejectedException;
import com.whereq.contextforge.exception.JobAccessDeniedException;
import com.whereq.contextforge.exception.NotFoundException;
import com.whereq.contextforge.exception.ValidationException;
import com.whereq.contextforge.model.Job;
import com.whereq.contextforge.model.JobStatus;
import com.whereq.contextforge.model.JobType;
import com.whereq.contextforge.model.payload.JobPayload;
import com.whereq.contextforge.queue.JobOptions;
import com.whereq.contextforge.queue.JobQueue;
import com.whereq.contextforge.worker.WorkerPool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Service for job submission and management on behalf of a caller
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Service
public class JobService {

    static final int STATS_WINDOW = 100;
    static final int RECENT_ACTIVITY = 10;

    @Autowired
    private JobQueue jobQueue;

    @Autowired
    private WorkerPool workerPool;

    @Autowired
    private ObjectMapper objectMapper;

    /**
     * Get a job owned by the caller
     *
     * @param jobId job identifier
     * @param userId caller
     * @return Mono with the job; errors with NotFoundException or JobAccessDeniedException
     */
    public Mono<Job> getJob(String jobId, String userId) {
        return Mono.fromCallable(() -> {
            Job job = jobQueue.getJobStatus(jobId).orElseThrow(() -> NotFoundException.job(jobId));
            if (!userId.equals(job.getUserId())) {
                throw new JobAccessDeniedException("Not authorized to access job " + jobId);
            }
            return job;
        });
    }

    /**
     * Cancel a pending or retrying job owned by the caller
     *
     * @param jobId job identifier
     * @param userId caller
     * @return Mono with cancellation response; errors with CancellationRejectedException
     *     if the job already started or finished
     */
    public Mono<JobCancellationResponse> cancelJob(String jobId, String userId) {
        return getJob(jobId, userId)
            .flatMap(job -> {
                if (!jobQueue.cancelJob(jobId)) {
                    JobStatus current = jobQueue.getJobStatus(jobId).map(Job::getStatus).orElse(job.getStatus());
                    return Mono.error(new CancellationRejectedException(jobId, current));
                }
                return Mono.just(JobCancellationResponse.builder()
                    .success(true)
                    .jobId(jobId)
                    .status(JobStatus.CANCELLED)
                    .cancelledAt(Instant.now())
                    .message("Job cancelled successfully")
                    .build());
            })
            .doOnSuccess(response -> log.info("Job {} cancelled by user {}", jobId, userId))
            .doOnError(e -> log.warn("Failed to cancel job {}: {}", jobId, e.getMessage()));
    }

    /**
     * Create one job from a raw payload. The payload's userId is always the caller.
     */
    public Mono<JobSubmitResponse> submitJob(CreateJobRequest request, String userId) {
        return Mono.fromCallable(() -> {
                JobPayload payload = toPayload(request, userId);
                String jobId = jobQueue.addJob(request.getType(), payload, JobOptions.builder()
                    .priority(request.getPriority())
                    .maxAttempts(request.getMaxAttempts())
                    .build());
                return JobSubmitResponse.builder()
                    .success(true)
                    .jobId(jobId)
                    .status(JobStatus.PENDING)
                    .submittedAt(Instant.now())
                    .build();
            })
            .doOnSuccess(response -> log.info("Job {} submitted by user {}", response.getJobId(), userId))
            .doOnError(e -> log.warn("Job submission failed for user {}: {}", userId, e.getMessage()));
    }

    /**
     * Caller's jobs, most recent first, optionally filtered by status and type
     */
    public Mono<List<JobStatusResponse>> listJobs(String userId, int limit, JobStatus status, JobType type) {
        return Mono.fromCallable(() -> jobQueue.getUserJobs(userId, Integer.MAX_VALUE).stream()
            .filter(job -> status == null || job.getStatus() == status)
            .filter(job -> type == null || job.getType() == type)
            .limit(Math.max(0, limit))
            .map(JobStatusResponse::from)
            .toList());
    }

    public Mono<JobStatsResponse> getStats(String userId) {
        return Mono.fromCallable(() -> {
            List<Job> jobs = jobQueue.getUserJobs(userId, STATS_WINDOW);

            Map<JobStatus, Long> byStatus = new EnumMap<>(JobStatus.class);
            for (JobStatus status : JobStatus.values()) {
                byStatus.put(status, 0L);
            }
            Map<JobType, Long> byType = new EnumMap<>(JobType.class);
            for (Job job : jobs) {
                byStatus.merge(job.getStatus(), 1L, Long::sum);
                byType.merge(job.getType(), 1L, Long::sum);
            }

            return JobStatsResponse.builder()
                .user(JobStatsResponse.UserStats.builder()
                    .total(jobs.size())
                    .jobsByStatus(byStatus)
                    .jobsByType(byType)
                    .recentActivity(jobs.stream().limit(RECENT_ACTIVITY).map(JobStatusResponse::from).toList())
                    .build())
                .system(JobStatsResponse.SystemStats.builder()
                    .workersRunning(workerPool.isRunning())
                    .workers(workerPool.getWorkerCount())
                    .activeExecutions(workerPool.getActiveExecutions())
                    .waitingJobs(jobQueue.size())
                    .queues(jobQueue.getQueueStats())
                    .build())
                .build();
        });
    }

    private JobPayload toPayload(CreateJobRequest request, String userId) {
        if (request.getType() == null) {
            throw new ValidationException("Job type is required");
        }
        if (request.getData() == null || !request.getData().isObject()) {
            throw new ValidationException("Job data must be a JSON object");
        }
        ObjectNode data = ((ObjectNode) request.getData()).deepCopy();
        data.put("userId", userId);
        try {
            return objectMapper.treeToValue(data, request.getType().getPayloadClass());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ValidationException("Invalid " + request.getType() + " payload: " + e.getMessage());
        }
    }
}
