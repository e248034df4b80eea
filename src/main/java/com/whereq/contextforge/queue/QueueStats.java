package com.whereq.contextforge.queue;

import com.whereq.contextforge.model.JobStatus;
import lombok.Data;

/**
 * Job counts by status for one job type
 */
@Data
public class QueueStats {
    private long pending;
    private long processing;
    private long completed;
    private long failed;
    private long retry;
    private long cancelled;

    public void increment(JobStatus status) {
        switch (status) {
            case PENDING -> pending++;
            case PROCESSING -> processing++;
            case COMPLETED -> completed++;
            case FAILED -> failed++;
            case RETRY -> retry++;
            case CANCELLED -> cancelled++;
        }
    }

    public long getTotal() {
        return pending + processing + completed + failed + retry + cancelled;
    }
}
