package com.alphamind.trial;

/**
 * Base type for failures that end a trial. Never thrown back to callers of the
 * lifecycle API; the supervisor turns them into a failed task.
 */
public class TrialException extends RuntimeException {
    public TrialException(String message) {
        super(message);
    }

    public TrialException(String message, Throwable cause) {
        super(message, cause);
    }
}
