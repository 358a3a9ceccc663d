package com.alphamind.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.stream.Stream;

/**
 * Talks to a running Alphamind server on behalf of the CLI. Tasks live in the server's memory,
 * so every read goes over HTTP.
 */
@Component
public class TaskApiClient {

    private final ObjectMapper objectMapper;
    private final HttpClient client = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();

    public TaskApiClient(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @return the {@code data} of the response, or empty when the task does not exist
     * @throws IOException on connection failures and unexpected responses
     */
    public Optional<JsonNode> get(int port, String path) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri(port, path))
                .header("Accept", "application/json")
                .GET()
                .build();
        HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() == 404) {
            return Optional.empty();
        }
        if (response.statusCode() != 200) {
            throw new IOException("Server returned HTTP " + response.statusCode());
        }
        return Optional.of(objectMapper.readTree(response.body()).path("data"));
    }

    /**
     * Streams the SSE events of a task, calling {@code onEvent(type, data)} per frame until the
     * server closes the stream.
     *
     * @return false if the task does not exist
     */
    public boolean watch(int port, String taskId, BiConsumer<String, String> onEvent)
            throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri(port, "/api/v1/tasks/" + taskId + "/events"))
                .header("Accept", "text/event-stream")
                .GET()
                .build();
        HttpResponse<Stream<String>> response = client.send(request, HttpResponse.BodyHandlers.ofLines());
        if (response.statusCode() == 404) {
            return false;
        }
        if (response.statusCode() != 200) {
            throw new IOException("Server returned HTTP " + response.statusCode());
        }
        final String[] currentEventType = {""};
        try (Stream<String> lines = response.body()) {
            lines.forEach(line -> {
                if (line.startsWith("event:")) {
                    currentEventType[0] = line.substring(6).trim();
                } else if (line.startsWith("data:")) {
                    String type = currentEventType[0].isEmpty() ? "message" : currentEventType[0];
                    onEvent.accept(type, line.substring(5).trim());
                    currentEventType[0] = "";
                }
            });
        }
        return true;
    }

    private static URI uri(int port, String path) {
        return URI.create("http://localhost:" + port + path);
    }
}
