package com.alphamind.trial;

/**
 * Starts trial processes. One implementation per target platform is selected at startup
 * (see {@link TrialConfig}); callers never branch on the platform.
 */
public interface TrialExecutor {

    /**
     * Starts the command. Does not retry.
     *
     * @return a handle over the running process
     * @throws LaunchException if the process could not be started
     */
    TrialHandle spawn(TrialCommand command);

    /**
     * Separator used when joining entries of a {@code PATH}-like variable.
     */
    String pathSeparator();
}
