package com.alphamind.core.registry;

import com.alphamind.core.model.LogEntry;
import com.alphamind.core.model.TaskKind;
import com.alphamind.core.model.TaskProgress;
import com.alphamind.core.model.TaskSnapshot;
import com.alphamind.core.model.TaskStatus;
import com.alphamind.trial.TrialHandle;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Mutable state of one supervised task.
 * <p>
 * All access goes through this object's monitor. Branches of a parallel mining task write
 * to the same record, and the event broadcaster holds the monitor while it replays history
 * to a new subscriber so no event is lost or duplicated across the attach.
 */
public class TaskRecord {

    private final String id;
    private final TaskKind kind;
    private final Map<String, Object> config;
    private final Instant createdAt;
    private final long sequence;
    private final int logCapacity;

    private final ArrayDeque<LogEntry> logs;
    private final Map<String, Double> metrics = new LinkedHashMap<>();
    /** Live processes keyed by branch index. */
    private final Map<Integer, TrialHandle> processes = new LinkedHashMap<>();

    private TaskStatus status = TaskStatus.RUNNING;
    private TaskProgress progress;
    private String message;
    private Instant updatedAt;

    TaskRecord(String id, TaskKind kind, Map<String, Object> config, TaskProgress progress,
               int logCapacity, long sequence) {
        this.id = id;
        this.kind = kind;
        this.config = config == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(config));
        this.progress = progress;
        this.logCapacity = logCapacity;
        this.logs = new ArrayDeque<>(Math.min(logCapacity, 64));
        this.sequence = sequence;
        this.createdAt = Instant.now();
        this.updatedAt = createdAt;
        this.message = progress.message();
    }

    public String id() {
        return id;
    }

    public TaskKind kind() {
        return kind;
    }

    public Instant createdAt() {
        return createdAt;
    }

    long sequence() {
        return sequence;
    }

    public synchronized TaskStatus status() {
        return status;
    }

    public synchronized boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * Moves the task to a terminal status. The first terminal transition wins.
     *
     * @return false if the task was already terminal and nothing changed
     */
    public synchronized boolean finish(TaskStatus target, String finalMessage) {
        if (!target.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + target);
        }
        if (status.isTerminal()) {
            return false;
        }
        status = target;
        message = finalMessage;
        touch();
        return true;
    }

    public synchronized String message() {
        return message;
    }

    public synchronized TaskProgress progress() {
        return progress;
    }

    public synchronized TaskProgress updateProgress(UnaryOperator<TaskProgress> update) {
        progress = update.apply(progress);
        touch();
        return progress;
    }

    /**
     * Appends a log entry, dropping the oldest entry once the capacity is reached.
     */
    public synchronized void appendLog(LogEntry entry) {
        if (logs.size() >= logCapacity) {
            logs.removeFirst();
        }
        logs.addLast(entry);
        touch();
    }

    public synchronized int logCount() {
        return logs.size();
    }

    /**
     * The most recent {@code n} log entries, oldest first.
     */
    public synchronized List<LogEntry> recentLogs(int n) {
        var all = new ArrayList<>(logs);
        return List.copyOf(all.subList(Math.max(0, all.size() - n), all.size()));
    }

    public synchronized Map<String, Double> putMetrics(Map<String, Double> values) {
        metrics.putAll(values);
        touch();
        return Map.copyOf(metrics);
    }

    public synchronized Map<String, Double> metrics() {
        return Map.copyOf(metrics);
    }

    /**
     * Records the live process of a branch.
     *
     * @throws IllegalStateException if the branch already has a live process
     */
    public synchronized void attachProcess(int branchIndex, TrialHandle handle) {
        if (processes.containsKey(branchIndex)) {
            throw new IllegalStateException("Branch " + branchIndex + " of task " + id
                    + " already has a live process");
        }
        processes.put(branchIndex, handle);
        touch();
    }

    /**
     * Clears the process handle of a branch at process exit.
     *
     * @return false if there was no handle to clear
     */
    public synchronized boolean detachProcess(int branchIndex) {
        boolean removed = processes.remove(branchIndex) != null;
        if (removed) {
            touch();
        }
        return removed;
    }

    public synchronized List<TrialHandle> liveProcesses() {
        return List.copyOf(processes.values());
    }

    public synchronized TaskSnapshot snapshot() {
        return new TaskSnapshot(
                id, kind, status, progress,
                Map.copyOf(metrics),
                List.copyOf(logs),
                processes.values().stream().map(TrialHandle::pid).toList(),
                message,
                config,
                createdAt,
                updatedAt);
    }

    private void touch() {
        updatedAt = Instant.now();
    }
}
