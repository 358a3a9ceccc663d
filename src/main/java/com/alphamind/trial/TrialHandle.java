package com.alphamind.trial;

import java.util.stream.Stream;

/**
 * A running trial process.
 */
public interface TrialHandle extends AutoCloseable {

    long pid();

    /**
     * Lazy stream over the process's combined stdout and stderr, one element per line,
     * in arrival order. Ends when the process closes its output.
     */
    Stream<String> lines();

    /**
     * Blocks until the process exits.
     * @return the exit code
     */
    int waitFor() throws InterruptedException;

    boolean isAlive();

    /**
     * Sends a normal termination request to the process and any processes it spawned.
     */
    void terminate();

    /**
     * Forcibly kills the process and any processes it spawned.
     */
    void kill();

    @Override
    void close();
}
