package com.whereq.contextforge.pipeline;

import com.whereq.contextforge.model.Job;
import com.whereq.contextforge.model.JobStatus;
import com.whereq.contextforge.model.JobType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Summary of a user's recent pipeline activity
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineStatus {
    /**
     * Number of jobs in the window
     */
    private int total;

    private Map<JobStatus, Long> jobsByStatus;

    private Map<JobType, Long> jobsByType;

    /**
     * Most recent jobs first
     */
    private List<Job> recentJobs;
}
