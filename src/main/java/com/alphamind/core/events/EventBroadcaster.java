package com.alphamind.core.events;

import com.alphamind.core.metrics.AlphamindMetrics;
import com.alphamind.core.model.LogEntry;
import com.alphamind.core.registry.TaskRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fans task events out to every live subscriber of that task.
 * <p>
 * Delivery is at-most-once: a subscriber whose delivery throws is removed immediately and
 * never retried. New subscribers first receive the current progress and the most recent log
 * entries, then live events.
 */
@Service
public class EventBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(EventBroadcaster.class);

    /** Subscribers keyed by taskId. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<EventSubscriber>> subscribers =
            new ConcurrentHashMap<>();

    private final int replaySize;
    private final AlphamindMetrics metrics;

    @Autowired
    public EventBroadcaster(StreamingProperties properties,
                            @Autowired(required = false) AlphamindMetrics metrics) {
        this(properties.getReplaySize(), metrics);
    }

    public EventBroadcaster(int replaySize) {
        this(replaySize, null);
    }

    EventBroadcaster(int replaySize, AlphamindMetrics metrics) {
        this.replaySize = replaySize;
        this.metrics = metrics;
    }

    /**
     * Delivers an event to every subscriber currently attached to its task.
     * Callers that mutate a task record publish while holding that record's monitor,
     * which keeps per-task delivery in emission order.
     */
    public void publish(TaskEvent event) {
        List<EventSubscriber> subs = subscribers.get(event.taskId());
        if (subs == null || subs.isEmpty()) {
            return;
        }
        log.trace("Publishing {} event for task {} to {} subscribers", event.type().wireName(),
                event.taskId(), subs.size());
        for (EventSubscriber subscriber : subs) {
            deliverOrPrune(event.taskId(), subscriber, event);
        }
    }

    /**
     * Attaches a subscriber to a task, replaying the current progress and the last log entries.
     * <p>
     * Replay and registration happen under the record's monitor, so an event produced while the
     * subscriber attaches is either part of the replay or delivered live, never both.
     *
     * @return a handle to detach later; a no-op handle if the replay itself failed
     */
    public Subscription subscribe(TaskRecord record, EventSubscriber subscriber) {
        String taskId = record.id();
        synchronized (record) {
            try {
                subscriber.deliver(TaskEvent.progress(taskId, record.progress()));
                for (LogEntry entry : record.recentLogs(replaySize)) {
                    subscriber.deliver(TaskEvent.log(taskId, entry));
                }
            } catch (Exception e) {
                log.debug("Replay to new subscriber of task {} failed, not attaching: {}", taskId, e.getMessage());
                if (metrics != null) {
                    metrics.recordPrunedSubscriber();
                }
                return () -> { };
            }
            subscribers.computeIfAbsent(taskId, k -> new CopyOnWriteArrayList<>()).add(subscriber);
        }
        log.debug("Subscribed to task {}", taskId);
        return () -> unsubscribe(taskId, subscriber);
    }

    /**
     * Answers a liveness probe from a subscriber with a heartbeat event.
     *
     * @return false if the reply could not be delivered and the subscriber was removed
     */
    public boolean heartbeat(String taskId, EventSubscriber subscriber) {
        return deliverOrPrune(taskId, subscriber, TaskEvent.heartbeat(taskId));
    }

    public int subscriberCount(String taskId) {
        List<EventSubscriber> subs = subscribers.get(taskId);
        return subs == null ? 0 : subs.size();
    }

    /**
     * Handle for detaching a subscriber.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void unsubscribe(String taskId, EventSubscriber subscriber) {
        CopyOnWriteArrayList<EventSubscriber> subs = subscribers.get(taskId);
        if (subs != null && subs.remove(subscriber)) {
            log.debug("Unsubscribed from task {}", taskId);
        }
    }

    private boolean deliverOrPrune(String taskId, EventSubscriber subscriber, TaskEvent event) {
        try {
            subscriber.deliver(event);
            return true;
        } catch (Exception e) {
            log.debug("Delivery of {} event to a subscriber of task {} failed, pruning it: {}",
                    event.type().wireName(), taskId, e.getMessage());
            CopyOnWriteArrayList<EventSubscriber> subs = subscribers.get(taskId);
            if (subs != null && subs.remove(subscriber) && metrics != null) {
                metrics.recordPrunedSubscriber();
            }
            return false;
        }
    }
}
