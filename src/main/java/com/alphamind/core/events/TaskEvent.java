package com.alphamind.core.events;

import com.alphamind.core.model.LogEntry;
import com.alphamind.core.model.TaskProgress;
import com.alphamind.core.model.TaskStatus;

import java.io.Serializable;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An event streamed to the subscribers of a task.
 *
 * @param type      event type
 * @param taskId    the task this event belongs to (nullable only for heartbeats)
 * @param data      event payload
 * @param timestamp when the event was emitted
 */
public record TaskEvent(
    EventType type,
    String taskId,
    Object data,
    Instant timestamp
) implements Serializable {

    public static TaskEvent progress(String taskId, TaskProgress progress) {
        return new TaskEvent(EventType.PROGRESS, taskId, progress, Instant.now());
    }

    public static TaskEvent log(String taskId, LogEntry entry) {
        return new TaskEvent(EventType.LOG, taskId, entry, Instant.now());
    }

    public static TaskEvent metrics(String taskId, Map<String, Double> metrics) {
        return new TaskEvent(EventType.METRICS, taskId, Map.copyOf(metrics), Instant.now());
    }

    public static TaskEvent result(String taskId, TaskStatus status, Map<String, Double> metrics) {
        var data = new LinkedHashMap<String, Object>();
        data.put("status", status);
        if (metrics != null) {
            data.put("metrics", Map.copyOf(metrics));
        }
        return new TaskEvent(EventType.RESULT, taskId, data, Instant.now());
    }

    public static TaskEvent error(String taskId, String message) {
        return new TaskEvent(EventType.ERROR, taskId, Map.of("error", message), Instant.now());
    }

    public static TaskEvent heartbeat(String taskId) {
        return new TaskEvent(EventType.HEARTBEAT, taskId, Map.of(), Instant.now());
    }
}
