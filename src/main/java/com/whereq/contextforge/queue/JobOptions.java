package com.whereq.contextforge.queue;

import com.whereq.contextforge.model.JobPriority;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Optional enqueue settings; unset fields fall back to the queue defaults
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobOptions {
    private JobPriority priority;

    /**
     * Total execution budget for the job
     */
    private Integer maxAttempts;

    public static JobOptions defaults() {
        return new JobOptions();
    }

    public static JobOptions withPriority(JobPriority priority) {
        return JobOptions.builder().priority(priority).build();
    }
}
