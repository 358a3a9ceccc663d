package com.alphamind.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.net.ConnectException;
import java.util.Optional;

/**
 * CLI command: alphamind list
 * <p>
 * Lists the tasks known to the running server, newest first.
 */
@Command(name = "list", mixinStandardHelpOptions = true, description = "List tasks")
@Component
public class ListCommand implements Runnable {

    @Option(names = {"--port"}, description = "Server port (default: ${DEFAULT-VALUE})",
            defaultValue = "8080")
    private int port;

    private final TaskApiClient client;

    public ListCommand(TaskApiClient client) {
        this.client = client;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        try {
            Optional<JsonNode> tasks = client.get(port, "/api/v1/tasks");
            if (tasks.isEmpty() || tasks.get().size() == 0) {
                ConsoleOutput.info("No tasks.");
                return;
            }
            System.out.println();
            System.out.printf("  %-10s %-10s %-10s %-12s %-5s %s%n",
                    "TASK", "KIND", "STATUS", "PHASE", "PCT", "CREATED");
            System.out.println("  " + "-".repeat(72));
            for (JsonNode task : tasks.get()) {
                JsonNode progress = task.path("progress");
                System.out.printf("  %-10s %-10s %-10s %-12s %3d%%  %s%n",
                        task.path("taskId").asText(),
                        task.path("kind").asText(),
                        task.path("status").asText(),
                        progress.path("phase").asText(),
                        progress.path("percent").asInt(),
                        task.path("createdAt").asText());
            }
        } catch (ConnectException e) {
            ConsoleOutput.error("Cannot connect to Alphamind server at localhost:" + port);
            ConsoleOutput.info("Start the server first: alphamind serve");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.info("Interrupted.");
        } catch (IOException e) {
            ConsoleOutput.error("List failed: " + e.getMessage());
        }
    }
}
