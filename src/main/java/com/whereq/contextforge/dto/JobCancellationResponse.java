package com.whereq.contextforge.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.whereq.contextforge.model.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response for job cancellation
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobCancellationResponse {
    private boolean success;

    private String jobId;

    /**
     * Status after the request: CANCELLED on success, the unchanged status otherwise
     */
    private JobStatus status;

    private Instant cancelledAt;

    private String message;

    public static JobCancellationResponse error(String jobId, JobStatus status, String message) {
        return JobCancellationResponse.builder()
            .success(false)
            .jobId(jobId)
            .status(status)
            .message(message)
            .build();
    }
}
