package com.whereq.contextforge.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.whereq.contextforge.model.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response for job creation
 *
 * @author WhereQ Inc.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobSubmitResponse {
    private boolean success;

    private String jobId;

    private JobStatus status;

    private Instant submittedAt;

    /**
     * Error message (if submission failed)
     */
    private String errorMessage;

    public static JobSubmitResponse error(String message) {
        return JobSubmitResponse.builder()
            .success(false)
            .errorMessage(message)
            .submittedAt(Instant.now())
            .build();
    }
}
