package com.whereq.contextforge.exception;

/**
 * Recoverable handler failure, the job is retried while attempts remain
 */
public class TransientExecutionException extends JobExecutionException {
    public TransientExecutionException(String message) {
        super(message);
    }

    public TransientExecutionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
