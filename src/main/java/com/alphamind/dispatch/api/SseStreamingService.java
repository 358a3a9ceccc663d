package com.alphamind.dispatch.api;

import com.alphamind.core.events.EventBroadcaster;
import com.alphamind.core.events.EventSubscriber;
import com.alphamind.core.events.EventType;
import com.alphamind.core.events.StreamingProperties;
import com.alphamind.core.events.TaskEvent;
import com.alphamind.core.registry.TaskRecord;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Bridges {@link EventBroadcaster} subscriptions to {@link SseEmitter} instances for SSE streaming.
 * <p>
 * Each emitter is one subscriber: it first receives the replayed progress and recent logs, then
 * live events, each as an SSE frame named after the event type. A periodic heartbeat event keeps
 * idle connections open through proxies; a heartbeat that cannot be delivered prunes the
 * subscriber and completes the emitter. The emitter is completed after the task's result event.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    private final EventBroadcaster broadcaster;
    private final long timeoutMs;
    private final long heartbeatIntervalSeconds;

    /** Tracks active emitter registrations for heartbeats and cleanup. */
    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(EventBroadcaster broadcaster, StreamingProperties properties) {
        this(broadcaster, TimeUnit.MINUTES.toMillis(properties.getEmitterTimeoutMinutes()),
                properties.getHeartbeatIntervalSeconds());
    }

    SseStreamingService(EventBroadcaster broadcaster, long timeoutMs, long heartbeatIntervalSeconds) {
        this.broadcaster = broadcaster;
        this.timeoutMs = timeoutMs;
        this.heartbeatIntervalSeconds = heartbeatIntervalSeconds;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(this::sendHeartbeats,
                heartbeatIntervalSeconds, heartbeatIntervalSeconds, TimeUnit.SECONDS);
        log.info("SSE heartbeat scheduler started (interval={}s)", heartbeatIntervalSeconds);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdown();
        try {
            if (!heartbeatScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("SSE heartbeat scheduler stopped");
    }

    /**
     * Creates an SSE emitter that streams events for the given task. For a task that already
     * finished, the replay is followed by a result event and the emitter completes.
     */
    public SseEmitter createEmitter(TaskRecord record) {
        String taskId = record.id();
        SseEmitter emitter = new SseEmitter(timeoutMs);
        EventSubscriber subscriber = event -> sendEvent(emitter, event);

        EventBroadcaster.Subscription subscription;
        boolean finished;
        // holding the record keeps a concurrent finish from landing between the check and the attach
        synchronized (record) {
            finished = record.isTerminal();
            subscription = broadcaster.subscribe(record, subscriber);
        }

        var registration = new EmitterRegistration(taskId, emitter, subscriber, subscription);
        activeRegistrations.add(registration);

        emitter.onCompletion(() -> {
            log.debug("SSE emitter completed for task {}", taskId);
            cleanup(registration);
        });
        emitter.onTimeout(() -> {
            log.debug("SSE emitter timed out for task {}", taskId);
            cleanup(registration);
        });
        emitter.onError(ex -> {
            log.debug("SSE emitter error for task {}: {}", taskId, ex.getMessage());
            cleanup(registration);
        });

        if (finished) {
            try {
                sendEvent(emitter, TaskEvent.result(taskId, record.status(), record.metrics()));
            } catch (IOException e) {
                log.debug("Failed to send final result for task {}: {}", taskId, e.getMessage());
                emitter.complete();
            }
        }

        log.info("SSE emitter created for task {} (timeout={}ms)", taskId, timeoutMs);
        return emitter;
    }

    /**
     * Returns the number of currently active SSE emitters.
     */
    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    void sendHeartbeats() {
        if (activeRegistrations.isEmpty()) {
            return;
        }
        log.debug("Sending heartbeat to {} active SSE emitters", activeRegistrations.size());
        for (EmitterRegistration registration : activeRegistrations) {
            if (!broadcaster.heartbeat(registration.taskId(), registration.subscriber())) {
                log.debug("Heartbeat failed for task {}, closing emitter", registration.taskId());
                cleanup(registration);
                registration.emitter().complete();
            }
        }
    }

    private void sendEvent(SseEmitter emitter, TaskEvent event) throws IOException {
        emitter.send(SseEmitter.event()
                .name(event.type().wireName())
                .data(event));
        if (event.type() == EventType.RESULT) {
            emitter.complete();
        }
    }

    private void cleanup(EmitterRegistration registration) {
        if (activeRegistrations.remove(registration)) {
            registration.subscription().unsubscribe();
            log.debug("Cleaned up SSE registration for task {}", registration.taskId());
        }
    }

    private record EmitterRegistration(
            String taskId,
            SseEmitter emitter,
            EventSubscriber subscriber,
            EventBroadcaster.Subscription subscription
    ) {}
}
