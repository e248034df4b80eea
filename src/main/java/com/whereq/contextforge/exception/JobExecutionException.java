package com.whereq.contextforge.exception;

/**
 * Failure raised by a job handler. The worker pool retries it only when {@link #isRetryable()}.
 */
public abstract class JobExecutionException extends RuntimeException {

    protected JobExecutionException(String message) {
        super(message);
    }

    protected JobExecutionException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract boolean isRetryable();
}
