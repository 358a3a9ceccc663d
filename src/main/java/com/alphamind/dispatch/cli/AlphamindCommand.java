package com.alphamind.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Alphamind.
 * Routes to subcommands: serve, status, list.
 */
@Command(
        name = "alphamind",
        mixinStandardHelpOptions = true,
        version = "Alphamind 0.1.0",
        description = "Supervisor for factor-mining and backtest trials",
        subcommands = {
                ServeCommand.class,
                StatusCommand.class,
                ListCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class AlphamindCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // reuse the parsed command so subcommands come from the same factory
        spec.commandLine().usage(System.out);
    }
}
