package com.alphamind.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: alphamind serve
 * <p>
 * Starts the HTTP server exposing the task REST API, SSE streams and task WebSockets.
 * The web server is enabled by {@link com.alphamind.AlphamindApplication#main} detecting
 * "serve" in args; the banner is printed once the server is ready.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Alphamind HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reached through --help style invocations; CliRunner skips picocli in serve mode.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Alphamind server running on port " + port);
        System.out.println();
        System.out.println("  API:        http://localhost:" + port + "/api/v1");
        System.out.println("  WebSocket:  ws://localhost:" + port + "/ws/tasks/{taskId}");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
