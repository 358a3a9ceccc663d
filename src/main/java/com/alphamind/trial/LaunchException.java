package com.alphamind.trial;

/**
 * Thrown when a trial process could not be started (command not found, permission denied, ...).
 */
public class LaunchException extends TrialException {
    public LaunchException(String message, Throwable cause) {
        super(message, cause);
    }
}
