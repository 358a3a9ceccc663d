package com.alphamind.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Read-only copy of a task record, as returned by the lifecycle API.
 *
 * @param pids pids of trial processes alive at snapshot time; empty once they exit
 */
public record TaskSnapshot(
    String taskId,
    TaskKind kind,
    TaskStatus status,
    TaskProgress progress,
    Map<String, Double> metrics,
    List<LogEntry> logs,
    List<Long> pids,
    String message,
    Map<String, Object> config,
    Instant createdAt,
    Instant updatedAt
) {}
