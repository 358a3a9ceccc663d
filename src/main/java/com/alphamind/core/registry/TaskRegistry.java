package com.alphamind.core.registry;

import com.alphamind.core.engine.SupervisorProperties;
import com.alphamind.core.model.TaskKind;
import com.alphamind.core.model.TaskProgress;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory store of task records, keyed by task id. Nothing survives a restart.
 */
@Component
public class TaskRegistry {

    private static final Comparator<TaskRecord> NEWEST_FIRST = Comparator
            .comparing(TaskRecord::createdAt)
            .thenComparingLong(TaskRecord::sequence)
            .reversed();

    private final ConcurrentHashMap<String, TaskRecord> tasks = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final int logCapacity;

    @Autowired
    public TaskRegistry(SupervisorProperties properties) {
        this(properties.getLogCapacity());
    }

    public TaskRegistry(int logCapacity) {
        if (logCapacity < 1) {
            throw new IllegalArgumentException("log capacity must be positive: " + logCapacity);
        }
        this.logCapacity = logCapacity;
    }

    /**
     * Creates a running task under a fresh id.
     */
    public TaskRecord create(TaskKind kind, Map<String, Object> config, TaskProgress initialProgress) {
        while (true) {
            String id = UUID.randomUUID().toString().substring(0, 8);
            var record = new TaskRecord(id, kind, config, initialProgress, logCapacity, sequence.incrementAndGet());
            if (tasks.putIfAbsent(id, record) == null) {
                return record;
            }
        }
    }

    /**
     * @throws TaskNotFoundException if the id is unknown
     */
    public TaskRecord get(String taskId) {
        TaskRecord record = taskId == null ? null : tasks.get(taskId);
        if (record == null) {
            throw new TaskNotFoundException(taskId);
        }
        return record;
    }

    public Optional<TaskRecord> find(String taskId) {
        return taskId == null ? Optional.empty() : Optional.ofNullable(tasks.get(taskId));
    }

    /**
     * All tasks, newest first.
     */
    public List<TaskRecord> list() {
        return tasks.values().stream().sorted(NEWEST_FIRST).toList();
    }

    public int size() {
        return tasks.size();
    }
}
