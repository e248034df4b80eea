package com.whereq.contextforge.worker;

/**
 * Callback handed to a running handler to report progress of the current execution
 */
@FunctionalInterface
public interface ProgressReporter {

    /**
     * @param percentage 0-100; lower values than the last reported one are ignored
     * @param message short description of the current step, may be null
     */
    void report(int percentage, String message);

    default void report(int percentage) {
        report(percentage, null);
    }

    static ProgressReporter noop() {
        return (percentage, message) -> { };
    }
}
