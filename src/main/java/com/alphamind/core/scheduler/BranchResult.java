package com.alphamind.core.scheduler;

/**
 * Outcome of one branch.
 *
 * @param exitCode  the trial's exit code, or -1 when it never produced one
 * @param error     the exception the runner threw, if any
 * @param elapsedMs wall-clock time spent in the runner
 */
public record BranchResult(Branch branch, int exitCode, Throwable error, long elapsedMs) {

    public boolean succeeded() {
        return error == null && exitCode == 0;
    }

    /**
     * Short human-readable reason for a failed branch.
     */
    public String failureReason() {
        if (error != null) {
            return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        }
        return "exit code " + exitCode;
    }
}
