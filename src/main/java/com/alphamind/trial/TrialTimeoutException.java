package com.alphamind.trial;

import java.time.Duration;

/**
 * Thrown when a trial exceeded its deadline and was killed.
 */
public class TrialTimeoutException extends TrialException {

    private final Duration timeout;

    public TrialTimeoutException(Duration timeout) {
        super("Trial timed out after " + timeout.toSeconds() + "s and was killed");
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
