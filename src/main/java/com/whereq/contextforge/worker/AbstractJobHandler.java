package com.whereq.contextforge.worker;

import com.whereq.contextforge.exception.PermanentExecutionException;
import com.whereq.contextforge.model.Job;
import com.whereq.contextforge.model.JobResult;
import com.whereq.contextforge.model.JobType;
import com.whereq.contextforge.model.payload.JobPayload;

/**
 * Base class for handlers bound to the payload class of their job type
 */
public abstract class AbstractJobHandler<P extends JobPayload> implements JobHandler {

    private final JobType jobType;
    private final Class<P> payloadClass;

    protected AbstractJobHandler(JobType jobType, Class<P> payloadClass) {
        if (!jobType.getPayloadClass().equals(payloadClass)) {
            throw new IllegalArgumentException(jobType + " jobs carry " + jobType.getPayloadClass().getSimpleName()
                + ", not " + payloadClass.getSimpleName());
        }
        this.jobType = jobType;
        this.payloadClass = payloadClass;
    }

    @Override
    public JobType getJobType() {
        return jobType;
    }

    @Override
    public JobResult execute(Job job, ProgressReporter progress) throws Exception {
        if (!payloadClass.isInstance(job.getPayload())) {
            throw new PermanentExecutionException("Job " + job.getId() + " has no " + payloadClass.getSimpleName());
        }
        return handle(job, payloadClass.cast(job.getPayload()), progress);
    }

    protected abstract JobResult handle(Job job, P payload, ProgressReporter progress) throws Exception;
}
