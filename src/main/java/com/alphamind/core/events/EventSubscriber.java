package com.alphamind.core.events;

/**
 * A live consumer of one task's events (an SSE connection, a WebSocket session, a test probe).
 * <p>
 * Throwing from {@link #deliver} marks the subscriber dead; it is removed and never retried.
 */
@FunctionalInterface
public interface EventSubscriber {

    void deliver(TaskEvent event) throws Exception;
}
