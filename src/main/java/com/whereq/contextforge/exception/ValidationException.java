package com.whereq.contextforge.exception;

import java.util.List;

/**
 * Exception thrown when a job payload, options or request is malformed
 */
public class ValidationException extends RuntimeException {

    private final List<String> violations;

    public ValidationException(String message) {
        this(message, List.of());
    }

    public ValidationException(String message, List<String> violations) {
        super(message);
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
