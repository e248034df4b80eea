package com.whereq.contextforge.exception;

/**
 * Exception thrown when an item or job does not exist
 */
public class NotFoundException extends RuntimeException {
    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException item(String itemId) {
        return new NotFoundException("Item " + itemId + " not found");
    }

    public static NotFoundException job(String jobId) {
        return new NotFoundException("Job " + jobId + " not found");
    }
}
