package com.alphamind.dispatch.api;

import com.alphamind.core.model.TaskSnapshot;

/**
 * Body of a successful start request.
 */
public record TaskStarted(String taskId, TaskSnapshot task) {
}
