package com.alphamind.trial;

/**
 * A trial process exited with a non-zero code.
 */
public class ProcessFailureException extends TrialException {

    private final int exitCode;

    public ProcessFailureException(int exitCode) {
        super("Trial failed (exit code: " + exitCode + ")");
        this.exitCode = exitCode;
    }

    public int getExitCode() {
        return exitCode;
    }
}
