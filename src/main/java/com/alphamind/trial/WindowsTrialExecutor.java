package com.alphamind.trial;

import java.util.List;

/**
 * Trial launcher for Windows hosts.
 * <p>
 * Commands are run directly, never through a {@code /bin/sh -c} wrapper. A bare interpreter
 * name without an extension gets {@code .exe} appended so {@link ProcessBuilder} can resolve it.
 */
public class WindowsTrialExecutor extends AbstractTrialExecutor {

    public WindowsTrialExecutor(List<String> extraPath) {
        super(extraPath);
    }

    @Override
    public String pathSeparator() {
        return ";";
    }

    @Override
    protected String pathVariable() {
        return "Path";
    }

    @Override
    protected List<String> adaptArgv(List<String> argv) {
        String program = argv.get(0);
        String fileName = program.substring(Math.max(program.lastIndexOf('/'), program.lastIndexOf('\\')) + 1);
        if (!fileName.contains(".")) {
            argv.set(0, program + ".exe");
        }
        return argv;
    }
}
