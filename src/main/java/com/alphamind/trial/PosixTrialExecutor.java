package com.alphamind.trial;

import java.util.List;

/**
 * Trial launcher for Linux and macOS.
 */
public class PosixTrialExecutor extends AbstractTrialExecutor {

    public PosixTrialExecutor(List<String> extraPath) {
        super(extraPath);
    }

    @Override
    public String pathSeparator() {
        return ":";
    }

    @Override
    protected String pathVariable() {
        return "PATH";
    }

    @Override
    protected List<String> adaptArgv(List<String> argv) {
        return argv;
    }
}
