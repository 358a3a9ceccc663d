package com.alphamind.dispatch.api;

import com.alphamind.core.engine.TaskService;
import com.alphamind.core.events.EventBroadcaster;
import com.alphamind.core.events.EventSubscriber;
import com.alphamind.core.registry.TaskRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.net.URI;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * WebSocket endpoint {@code /ws/tasks/{taskId}} streaming the events of one task.
 * <p>
 * On connect the session receives the replayed progress and recent logs, then live events as
 * JSON text frames. A {@code ping} text frame is answered with a heartbeat event.
 */
@Component
public class TaskWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(TaskWebSocketHandler.class);

    static final int SEND_TIME_LIMIT_MS = 10_000;
    static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final TaskService taskService;
    private final EventBroadcaster broadcaster;
    private final ObjectMapper objectMapper;

    /** Active subscriptions, keyed by session id. */
    private final Map<String, SessionState> sessions = new ConcurrentHashMap<>();

    public TaskWebSocketHandler(TaskService taskService, EventBroadcaster broadcaster, ObjectMapper objectMapper) {
        this.taskService = taskService;
        this.broadcaster = broadcaster;
        this.objectMapper = objectMapper;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        String taskId = taskIdOf(session.getUri());
        TaskRecord record = taskService.findRecord(taskId).orElse(null);
        if (record == null) {
            log.debug("WebSocket session {} asked for unknown task {}", session.getId(), taskId);
            session.close(CloseStatus.POLICY_VIOLATION.withReason("Task not found"));
            return;
        }

        var safeSession = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
        EventSubscriber subscriber = event ->
                safeSession.sendMessage(new TextMessage(objectMapper.writeValueAsString(event)));
        EventBroadcaster.Subscription subscription = broadcaster.subscribe(record, subscriber);
        sessions.put(session.getId(), new SessionState(taskId, subscriber, subscription));
        log.info("WebSocket session {} opened for task {}", session.getId(), taskId);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        SessionState state = sessions.get(session.getId());
        if (state == null) {
            return;
        }
        if ("ping".equalsIgnoreCase(message.getPayload().trim())) {
            broadcaster.heartbeat(state.taskId(), state.subscriber());
        } else {
            log.debug("Ignoring message on task {} socket: {}", state.taskId(), message.getPayload());
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) throws IOException {
        log.debug("WebSocket transport error on session {}: {}", session.getId(), exception.getMessage());
        release(session);
        if (session.isOpen()) {
            session.close(CloseStatus.SERVER_ERROR);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        release(session);
        log.info("WebSocket session {} closed: {}", session.getId(), status);
    }

    int sessionCount() {
        return sessions.size();
    }

    private void release(WebSocketSession session) {
        SessionState state = sessions.remove(session.getId());
        if (state != null) {
            state.subscription().unsubscribe();
        }
    }

    static String taskIdOf(URI uri) {
        if (uri == null) {
            return null;
        }
        String path = uri.getPath();
        if (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        return path.substring(path.lastIndexOf('/') + 1);
    }

    private record SessionState(
            String taskId,
            EventSubscriber subscriber,
            EventBroadcaster.Subscription subscription
    ) {}
}
