package com.alphamind.trial;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Launches trials with {@link ProcessBuilder}, stderr merged into stdout.
 * Subclasses supply the platform-specific pieces.
 */
abstract class AbstractTrialExecutor implements TrialExecutor {

    private static final Logger log = LoggerFactory.getLogger(AbstractTrialExecutor.class);

    private final List<String> extraPath;

    protected AbstractTrialExecutor(List<String> extraPath) {
        this.extraPath = extraPath != null ? List.copyOf(extraPath) : List.of();
    }

    @Override
    public TrialHandle spawn(TrialCommand command) {
        List<String> argv = adaptArgv(new ArrayList<>(command.argv()));
        var pb = new ProcessBuilder(argv);
        pb.redirectErrorStream(true);
        if (command.workingDir() != null) {
            pb.directory(command.workingDir().toFile());
        }
        Map<String, String> env = pb.environment();
        env.putAll(command.env());
        if (!extraPath.isEmpty()) {
            env.put(pathVariable(), prependPath(env.get(pathVariable())));
        }

        Process process;
        try {
            process = pb.start();
        } catch (IOException | SecurityException e) {
            throw new LaunchException("Could not start trial " + argv.get(0) + ": " + e.getMessage(), e);
        }
        log.info("Started trial process {} ({})", process.pid(), String.join(" ", argv));
        return new ProcessTrialHandle(process);
    }

    String prependPath(String current) {
        String joined = String.join(pathSeparator(), extraPath);
        if (current == null || current.isBlank()) {
            return joined;
        }
        return joined + pathSeparator() + current;
    }

    /**
     * Name of the executable search-path variable.
     */
    protected abstract String pathVariable();

    /**
     * Rewrites the argument vector for the platform, if needed.
     */
    protected abstract List<String> adaptArgv(List<String> argv);
}
