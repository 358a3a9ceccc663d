package com.alphamind.core.model;

/**
 * Lifecycle status of a supervised task.
 * <p>
 * {@code RUNNING} is the only non-terminal status; a task never re-enters it.
 */
public enum TaskStatus {
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
