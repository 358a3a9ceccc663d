package com.alphamind.core.events;

import com.alphamind.core.model.LogEntry;
import com.alphamind.core.model.Phase;
import com.alphamind.core.model.TaskProgress;
import com.alphamind.core.model.TaskStatus;
import com.alphamind.core.registry.TaskRecord;

import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Write side of one task: mutates the record and publishes the matching event in one step,
 * under the record's monitor.
 */
public class TaskReporter {

    private final TaskRecord record;
    private final EventBroadcaster broadcaster;

    public TaskReporter(TaskRecord record, EventBroadcaster broadcaster) {
        this.record = record;
        this.broadcaster = broadcaster;
    }

    public String taskId() {
        return record.id();
    }

    public TaskRecord record() {
        return record;
    }

    /**
     * Retains a log entry and, when {@code forward} is set, streams it live.
     */
    public void log(LogEntry entry, boolean forward) {
        synchronized (record) {
            record.appendLog(entry);
            if (forward) {
                broadcaster.publish(TaskEvent.log(record.id(), entry));
            }
        }
    }

    public void phase(Phase phase, String message) {
        progress(p -> p.withPhase(phase, message));
    }

    public void progressMessage(String message) {
        progress(p -> p.withMessage(message));
    }

    public void round(int round) {
        progress(p -> p.withRound(round));
    }

    public void progress(UnaryOperator<TaskProgress> update) {
        synchronized (record) {
            TaskProgress updated = record.updateProgress(update);
            broadcaster.publish(TaskEvent.progress(record.id(), updated));
        }
    }

    public void metrics(Map<String, Double> values) {
        synchronized (record) {
            Map<String, Double> all = record.putMetrics(values);
            broadcaster.publish(TaskEvent.metrics(record.id(), all));
        }
    }

    public void error(String message) {
        broadcaster.publish(TaskEvent.error(record.id(), message));
    }

    /**
     * Moves the task to a terminal status and publishes the final result.
     * Does nothing if another terminal transition (e.g. a cancel) already happened.
     *
     * @return whether this call decided the terminal status
     */
    public boolean finish(TaskStatus status, String message, UnaryOperator<TaskProgress> progressUpdate) {
        synchronized (record) {
            if (!record.finish(status, message)) {
                return false;
            }
            record.updateProgress(progressUpdate);
            broadcaster.publish(TaskEvent.progress(record.id(), record.progress()));
            broadcaster.publish(TaskEvent.result(record.id(), status, record.metrics()));
            return true;
        }
    }
}
