package com.alphamind.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.net.ConnectException;
import java.util.Optional;

/**
 * CLI command: alphamind status &lt;task-id&gt;
 * <p>
 * Fetches a task from the running server and prints its status, progress, metrics and most
 * recent logs. With {@code --watch} it follows the task's SSE stream instead.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show task status")
@Component
public class StatusCommand implements Runnable {

    static final int RECENT_LOG_LINES = 10;

    @Parameters(index = "0", description = "Task ID")
    private String taskId;

    @Option(names = {"--watch", "-w"}, description = "Watch for live updates via SSE")
    private boolean watch;

    @Option(names = {"--port"}, description = "Server port (default: ${DEFAULT-VALUE})",
            defaultValue = "8080")
    private int port;

    private final TaskApiClient client;

    public StatusCommand(TaskApiClient client) {
        this.client = client;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        try {
            if (watch) {
                runWatchMode();
                return;
            }
            Optional<JsonNode> task = client.get(port, "/api/v1/tasks/" + taskId);
            if (task.isEmpty()) {
                ConsoleOutput.error("Task not found: " + taskId);
                return;
            }
            print(task.get());
        } catch (ConnectException e) {
            ConsoleOutput.error("Cannot connect to Alphamind server at localhost:" + port);
            ConsoleOutput.info("Start the server first: alphamind serve");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.info("Interrupted.");
        } catch (IOException e) {
            ConsoleOutput.error("Status failed: " + e.getMessage());
        }
    }

    private void runWatchMode() throws IOException, InterruptedException {
        ConsoleOutput.info("Watching task " + taskId + " (connecting to localhost:" + port + ")...");
        System.out.println();
        if (!client.watch(port, taskId, ConsoleOutput::watchEvent)) {
            ConsoleOutput.error("Task not found: " + taskId);
            return;
        }
        System.out.println();
        ConsoleOutput.info("Stream ended.");
    }

    static void print(JsonNode task) {
        System.out.println();
        System.out.println("TASK " + task.path("taskId").asText() + " (" + task.path("kind").asText() + ")");
        ConsoleOutput.status(task.path("status").asText());

        JsonNode progress = task.path("progress");
        ConsoleOutput.info(String.format("Phase: %s | Round: %d/%d | %d%%",
                progress.path("phase").asText(), progress.path("currentRound").asInt(),
                progress.path("totalRounds").asInt(), progress.path("percent").asInt()));
        if (!progress.path("message").asText().isEmpty()) {
            ConsoleOutput.info(progress.path("message").asText());
        }
        if (!task.path("message").isNull() && !task.path("message").asText().isEmpty()) {
            ConsoleOutput.info("Message: " + task.path("message").asText());
        }

        JsonNode metrics = task.path("metrics");
        if (metrics.size() > 0) {
            System.out.println();
            metrics.fields().forEachRemaining(metric ->
                    System.out.printf("  %-20s %s%n", metric.getKey(), metric.getValue().asText()));
        }

        JsonNode logs = task.path("logs");
        if (logs.size() > 0) {
            System.out.println();
            for (int i = Math.max(0, logs.size() - RECENT_LOG_LINES); i < logs.size(); i++) {
                ConsoleOutput.log(logs.get(i).path("level").asText(), logs.get(i).path("message").asText());
            }
        }
    }
}
