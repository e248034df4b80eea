package com.whereq.contextforge.exception;

/**
 * Exception thrown when a caller touches a job owned by another user
 */
public class JobAccessDeniedException extends RuntimeException {
    public JobAccessDeniedException(String message) {
        super(message);
    }
}
