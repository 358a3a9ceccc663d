package com.alphamind.dispatch.api;

import com.alphamind.core.engine.TaskService;
import com.alphamind.core.events.EventBroadcaster;
import com.alphamind.core.events.TaskReporter;
import com.alphamind.core.model.Phase;
import com.alphamind.core.model.TaskKind;
import com.alphamind.core.model.TaskProgress;
import com.alphamind.core.registry.TaskRecord;
import com.alphamind.core.registry.TaskRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class TaskWebSocketHandlerTest {

    private TaskRegistry registry;
    private EventBroadcaster broadcaster;
    private TaskService taskService;
    private TaskWebSocketHandler handler;
    private WebSocketSession session;

    @BeforeEach
    void setUp() {
        registry = new TaskRegistry(500);
        broadcaster = new EventBroadcaster(20);
        taskService = mock(TaskService.class);
        handler = new TaskWebSocketHandler(taskService, broadcaster, new ObjectMapper().registerModule(new JavaTimeModule()));
        session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn("s1");
        when(session.isOpen()).thenReturn(true);
    }

    private TaskRecord connect() throws Exception {
        TaskRecord record = registry.create(TaskKind.MINING, Map.of(),
                TaskProgress.initial(Phase.PLANNING, 3, "Starting experiment..."));
        when(taskService.findRecord(record.id())).thenReturn(Optional.of(record));
        when(session.getUri()).thenReturn(URI.create("ws://localhost:8080/ws/tasks/" + record.id()));
        handler.afterConnectionEstablished(session);
        return record;
    }

    private List<String> sentPayloads() throws Exception {
        @SuppressWarnings("unchecked")
        ArgumentCaptor<WebSocketMessage<?>> captor = ArgumentCaptor.forClass(WebSocketMessage.class);
        verify(session, atLeastOnce()).sendMessage(captor.capture());
        return captor.getAllValues().stream().map(m -> (String) m.getPayload()).toList();
    }

    @Test
    @DisplayName("connecting replays the current progress")
    void replaysOnConnect() throws Exception {
        connect();

        List<String> payloads = sentPayloads();
        assertEquals(1, payloads.size());
        assertTrue(payloads.get(0).contains("\"type\":\"progress\""));
        assertTrue(payloads.get(0).contains("Starting experiment..."));
        assertEquals(1, handler.sessionCount());
    }

    @Test
    @DisplayName("live events are sent as JSON text frames")
    void forwardsLiveEvents() throws Exception {
        TaskRecord record = connect();

        new TaskReporter(record, broadcaster).phase(Phase.EVOLVING, "factor_propose");

        List<String> payloads = sentPayloads();
        assertEquals(2, payloads.size());
        assertTrue(payloads.get(1).contains("\"phase\":\"EVOLVING\""));
    }

    @Test
    @DisplayName("a ping frame is answered with a heartbeat")
    void pingGetsHeartbeat() throws Exception {
        connect();

        handler.handleTextMessage(session, new TextMessage("ping"));

        List<String> payloads = sentPayloads();
        assertTrue(payloads.get(payloads.size() - 1).contains("\"type\":\"heartbeat\""));
    }

    @Test
    @DisplayName("an unknown task closes the session")
    void unknownTask() throws Exception {
        when(session.getUri()).thenReturn(URI.create("ws://localhost:8080/ws/tasks/deadbeef"));
        when(taskService.findRecord("deadbeef")).thenReturn(Optional.empty());

        handler.afterConnectionEstablished(session);

        verify(session).close(CloseStatus.POLICY_VIOLATION.withReason("Task not found"));
        verify(session, never()).sendMessage(any());
        assertEquals(0, handler.sessionCount());
    }

    @Test
    @DisplayName("closing the session detaches it from the task")
    void closeDetaches() throws Exception {
        TaskRecord record = connect();
        assertEquals(1, broadcaster.subscriberCount(record.id()));

        handler.afterConnectionClosed(session, CloseStatus.NORMAL);

        assertEquals(0, broadcaster.subscriberCount(record.id()));
        assertEquals(0, handler.sessionCount());
    }

    @Test
    @DisplayName("a transport error detaches and closes the session")
    void transportError() throws Exception {
        TaskRecord record = connect();

        handler.handleTransportError(session, new IOException("connection reset"));

        assertEquals(0, broadcaster.subscriberCount(record.id()));
        verify(session).close(CloseStatus.SERVER_ERROR);
    }

    @Test
    @DisplayName("the task id is the last path segment")
    void taskIdOf() {
        assertEquals("a1b2c3d4", TaskWebSocketHandler.taskIdOf(URI.create("ws://h/ws/tasks/a1b2c3d4")));
        assertEquals("a1b2c3d4", TaskWebSocketHandler.taskIdOf(URI.create("ws://h/ws/tasks/a1b2c3d4/")));
        assertNull(TaskWebSocketHandler.taskIdOf(null));
    }
}
