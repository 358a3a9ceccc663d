package com.alphamind.trial;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.stream.Stream;

/**
 * {@link TrialHandle} over a {@link Process} started with a merged error stream.
 */
class ProcessTrialHandle implements TrialHandle {

    private static final Logger log = LoggerFactory.getLogger(ProcessTrialHandle.class);

    private final Process process;
    private final BufferedReader reader;

    ProcessTrialHandle(Process process) {
        this.process = process;
        var decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        this.reader = new BufferedReader(new InputStreamReader(process.getInputStream(), decoder));
    }

    @Override
    public long pid() {
        return process.pid();
    }

    @Override
    public Stream<String> lines() {
        return reader.lines();
    }

    @Override
    public int waitFor() throws InterruptedException {
        return process.waitFor();
    }

    @Override
    public boolean isAlive() {
        return process.isAlive();
    }

    @Override
    public void terminate() {
        process.descendants().forEach(ProcessHandle::destroy);
        process.destroy();
    }

    @Override
    public void kill() {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    @Override
    public void close() {
        try {
            reader.close();
        } catch (IOException e) {
            log.debug("Could not close output of process {}: {}", pid(), e.getMessage());
        }
        if (process.isAlive()) {
            kill();
        }
    }
}
