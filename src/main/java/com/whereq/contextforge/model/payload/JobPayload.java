package com.whereq.contextforge.model.payload;

/**
 * Typed job payload. Every {@link com.whereq.contextforge.model.JobType} binds one implementation,
 * validated with Bean Validation when the job is enqueued.
 */
public interface JobPayload {

    /**
     * Owner of the job
     */
    String getUserId();

    void setUserId(String userId);
}
