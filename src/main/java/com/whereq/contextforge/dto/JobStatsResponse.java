package com.whereq.contextforge.dto;

import com.whereq.contextforge.model.JobStatus;
import com.whereq.contextforge.model.JobType;
import com.whereq.contextforge.queue.QueueStats;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Job statistics for the caller plus system-wide queue state
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobStatsResponse {

    private UserStats user;

    private SystemStats system;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class UserStats {
        private int total;
        private Map<JobStatus, Long> jobsByStatus;
        private Map<JobType, Long> jobsByType;
        private List<JobStatusResponse> recentActivity;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SystemStats {
        private boolean workersRunning;
        private int workers;
        private int activeExecutions;
        private long waitingJobs;
        private Map<JobType, QueueStats> queues;
    }
}
