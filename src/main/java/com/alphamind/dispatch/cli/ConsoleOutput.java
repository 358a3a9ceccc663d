package com.alphamind.dispatch.cli;

import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Alphamind CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) ALPHAMIND v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [ALPHAMIND]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void status(String status) {
        switch (status) {
            case "COMPLETED" -> success("Status: " + status);
            case "FAILED", "CANCELLED" -> error("Status: " + status);
            default -> info("Status: " + status);
        }
    }

    public static void log(String level, String message) {
        String color = switch (level) {
            case "ERROR" -> "fg(red)";
            case "WARNING" -> "fg(yellow)";
            case "SUCCESS" -> "fg(green)";
            default -> "fg(white)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|" + color + " " + level + "|@ " + escape(message)));
    }

    public static void watchEvent(String eventType, String data) {
        String prefix = switch (eventType) {
            case "progress" -> "@|fg(cyan) [PROGRESS]|@";
            case "log" -> "@|fg(white) [LOG]|@";
            case "metrics" -> "@|fg(magenta) [METRICS]|@";
            case "result" -> "@|bold,fg(green) [RESULT]|@";
            case "error" -> "@|fg(red),bold [ERROR]|@";
            case "heartbeat" -> "@|faint [HEARTBEAT]|@";
            default -> "@|fg(white) [" + eventType + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix) + " " + data);
    }

    /** Trial output may contain picocli markup characters. */
    private static String escape(String text) {
        return text.replace("@|", "@ |");
    }
}
