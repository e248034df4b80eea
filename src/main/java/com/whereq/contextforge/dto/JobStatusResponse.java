package com.whereq.contextforge.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.whereq.contextforge.model.Job;
import com.whereq.contextforge.model.JobPriority;
import com.whereq.contextforge.model.JobResult;
import com.whereq.contextforge.model.JobStatus;
import com.whereq.contextforge.model.JobType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response for job status query
 *
 * @author WhereQ Inc.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobStatusResponse {
    private String jobId;

    private JobType type;

    private JobStatus status;

    private JobPriority priority;

    /**
     * 0-100
     */
    private Integer progress;

    /**
     * Failed executions so far
     */
    private Integer attempts;

    private Integer maxAttempts;

    private Instant createdAt;

    private Instant startedAt;

    private Instant completedAt;

    /**
     * Error message (if failed or waiting for retry)
     */
    private String errorMessage;

    /**
     * Job result (if completed)
     */
    private JobResult result;

    public static JobStatusResponse from(Job job) {
        return JobStatusResponse.builder()
            .jobId(job.getId())
            .type(job.getType())
            .status(job.getStatus())
            .priority(job.getPriority())
            .progress(job.getProgress())
            .attempts(job.getAttempts())
            .maxAttempts(job.getMaxAttempts())
            .createdAt(job.getCreatedAt())
            .startedAt(job.getStartedAt())
            .completedAt(job.getCompletedAt())
            .errorMessage(job.getError())
            .result(job.getResult())
            .build();
    }

    public static JobStatusResponse error(String message) {
        return JobStatusResponse.builder()
            .errorMessage(message)
            .build();
    }
}
