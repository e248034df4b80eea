package com.whereq.contextforge.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Event pushed to clients about job and pipeline activity
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NotificationEvent {

    private EventType type;

    private String jobId;

    private JobType jobType;

    private JobStatus status;

    private Integer progress;

    private String message;

    @Builder.Default
    private Instant timestamp = Instant.now();

    public enum EventType {
        JOB_STARTED,
        JOB_PROGRESS,
        JOB_COMPLETED,
        JOB_RETRY,
        JOB_FAILED,
        PIPELINE_STARTED,
        PIPELINE_FAILED,
        BATCH_COMPLETED,
        DUPLICATE_DETECTION_STARTED
    }

    public static NotificationEvent forJob(EventType type, Job job, String message) {
        return NotificationEvent.builder()
            .type(type)
            .jobId(job.getId())
            .jobType(job.getType())
            .status(job.getStatus())
            .progress(job.getProgress())
            .message(message)
            .build();
    }

    public static NotificationEvent pipeline(EventType type, String message) {
        return NotificationEvent.builder()
            .type(type)
            .message(message)
            .build();
    }
}
