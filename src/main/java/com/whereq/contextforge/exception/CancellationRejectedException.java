package com.whereq.contextforge.exception;

import com.whereq.contextforge.model.JobStatus;

/**
 * Exception thrown when cancel is requested for a job that is not PENDING or RETRY
 */
public class CancellationRejectedException extends RuntimeException {

    private final JobStatus currentStatus;

    public CancellationRejectedException(String jobId, JobStatus currentStatus) {
        super("Job " + jobId + " cannot be cancelled in status " + currentStatus);
        this.currentStatus = currentStatus;
    }

    public JobStatus getCurrentStatus() {
        return currentStatus;
    }
}
