package com.whereq.contextforge.exception;

/**
 * Non-retryable handler failure, the job fails immediately
 */
public class PermanentExecutionException extends JobExecutionException {
    public PermanentExecutionException(String message) {
        super(message);
    }

    public PermanentExecutionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
