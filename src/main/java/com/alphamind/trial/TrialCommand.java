package com.alphamind.trial;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Everything needed to launch one trial process.
 *
 * @param argv       program and arguments, not shell-interpreted
 * @param workingDir working directory for the process
 * @param env        variables added on top of the supervisor's own environment
 */
public record TrialCommand(
    List<String> argv,
    Path workingDir,
    Map<String, String> env
) {
    public TrialCommand {
        if (argv == null || argv.isEmpty()) {
            throw new IllegalArgumentException("trial command cannot be empty");
        }
        argv = List.copyOf(argv);
        env = env == null ? Map.of() : Map.copyOf(env);
    }
}
