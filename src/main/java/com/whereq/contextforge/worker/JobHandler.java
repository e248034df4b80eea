package com.whereq.contextforge.worker;

import com.whereq.contextforge.model.Job;
import com.whereq.contextforge.model.JobResult;
import com.whereq.contextforge.model.JobType;

/**
 * Executes jobs of one type
 */
public interface JobHandler {

    JobType getJobType();

    /**
     * Execute a job synchronously (blocking).
     * Handlers must be idempotent: a job may run again after a timeout or a restart.
     *
     * @param job the claimed job
     * @param progress progress callback for this execution
     * @return job result, may be null
     * @throws Exception if execution fails; a
     *     {@link com.whereq.contextforge.exception.PermanentExecutionException} is not retried
     */
    JobResult execute(Job job, ProgressReporter progress) throws Exception;
}
