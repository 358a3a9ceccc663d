package com.alphamind.core.events;

import com.alphamind.core.metrics.AlphamindMetrics;
import com.alphamind.core.model.LogEntry;
import com.alphamind.core.model.LogLevel;
import com.alphamind.core.model.Phase;
import com.alphamind.core.model.TaskKind;
import com.alphamind.core.model.TaskProgress;
import com.alphamind.core.model.TaskStatus;
import com.alphamind.core.registry.TaskRecord;
import com.alphamind.core.registry.TaskRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link EventBroadcaster} and {@link TaskReporter}.
 */
class EventBroadcasterTest {

    private SimpleMeterRegistry meterRegistry;
    private EventBroadcaster broadcaster;
    private TaskRecord record;
    private TaskReporter reporter;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        broadcaster = new EventBroadcaster(20, new AlphamindMetrics(meterRegistry));
        record = new TaskRegistry(500).create(TaskKind.MINING, Map.of(),
                TaskProgress.initial(Phase.PLANNING, 3, "Starting"));
        reporter = new TaskReporter(record, broadcaster);
    }

    private static List<String> logMessages(List<TaskEvent> events) {
        return events.stream()
                .filter(e -> e.type() == EventType.LOG)
                .map(e -> ((LogEntry) e.data()).message())
                .toList();
    }

    @Nested
    @DisplayName("replay")
    class ReplayTests {

        @Test
        @DisplayName("new subscriber gets progress and the last 20 logs, then live events")
        void replaysThenLive() {
            for (int i = 1; i <= 25; i++) {
                reporter.log(LogEntry.of(LogLevel.INFO, "line " + i), false);
            }

            List<TaskEvent> received = new ArrayList<>();
            broadcaster.subscribe(record, received::add);

            assertEquals(21, received.size());
            assertEquals(EventType.PROGRESS, received.get(0).type());
            assertEquals(record.progress(), received.get(0).data());
            List<String> replayed = logMessages(received);
            assertEquals(20, replayed.size());
            assertEquals("line 6", replayed.get(0));
            assertEquals("line 25", replayed.get(19));

            reporter.log(LogEntry.of(LogLevel.INFO, "line 26"), true);
            assertEquals(22, received.size());
            assertEquals("line 26", ((LogEntry) received.get(21).data()).message());
        }

        @Test
        @DisplayName("events emitted while subscribing are neither lost nor duplicated")
        void concurrentAttach() throws InterruptedException {
            int total = 2_000;
            var start = new CountDownLatch(1);
            Thread writer = new Thread(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                for (int i = 1; i <= total; i++) {
                    reporter.log(LogEntry.of(LogLevel.INFO, "line " + i), true);
                }
            });
            writer.start();

            List<TaskEvent> received = new CopyOnWriteArrayList<>();
            start.countDown();
            broadcaster.subscribe(record, received::add);
            writer.join(TimeUnit.SECONDS.toMillis(10));

            List<String> messages = logMessages(received);
            int first = Integer.parseInt(messages.get(0).substring(5));
            for (int i = 0; i < messages.size(); i++) {
                assertEquals("line " + (first + i), messages.get(i), "gap or duplicate at index " + i);
            }
            assertEquals("line " + total, messages.get(messages.size() - 1));
        }
    }

    @Nested
    @DisplayName("publish")
    class PublishTests {

        @Test
        @DisplayName("delivers only to subscribers of the event's task")
        void scopedToTask() {
            List<TaskEvent> received = new ArrayList<>();
            broadcaster.subscribe(record, received::add);
            received.clear();

            broadcaster.publish(TaskEvent.error("other-task", "boom"));
            reporter.error("boom");

            assertEquals(1, received.size());
            assertEquals(Map.of("error", "boom"), received.get(0).data());
        }

        @Test
        @DisplayName("a failing subscriber is pruned and never retried")
        void prunesFailingSubscriber() {
            List<TaskEvent> healthy = new ArrayList<>();
            int[] attempts = {0};
            broadcaster.subscribe(record, healthy::add);
            broadcaster.subscribe(record, event -> {
                if (++attempts[0] > 1) {
                    throw new IOException("broken pipe");
                }
            });
            assertEquals(2, broadcaster.subscriberCount(record.id()));

            reporter.error("first");
            reporter.error("second");

            assertEquals(1, broadcaster.subscriberCount(record.id()));
            assertEquals(2, attempts[0]);
            assertEquals(3, healthy.size());
            assertEquals(1.0, meterRegistry.find("alphamind.subscribers.pruned").counter().count());
        }

        @Test
        @DisplayName("a subscriber whose replay fails is not attached")
        void replayFailure() {
            EventBroadcaster.Subscription subscription = broadcaster.subscribe(record, event -> {
                throw new IOException("closed");
            });

            assertEquals(0, broadcaster.subscriberCount(record.id()));
            subscription.unsubscribe();
        }

        @Test
        @DisplayName("unsubscribe stops delivery")
        void unsubscribe() {
            List<TaskEvent> received = new ArrayList<>();
            var subscription = broadcaster.subscribe(record, received::add);
            received.clear();

            subscription.unsubscribe();
            reporter.error("late");

            assertTrue(received.isEmpty());
            assertEquals(0, broadcaster.subscriberCount(record.id()));
        }
    }

    @Nested
    @DisplayName("heartbeat")
    class HeartbeatTests {

        @Test
        @DisplayName("replies with a heartbeat event to the asking subscriber only")
        void repliesToAsker() {
            List<TaskEvent> asker = new ArrayList<>();
            List<TaskEvent> other = new ArrayList<>();
            EventSubscriber askerSubscriber = asker::add;
            broadcaster.subscribe(record, askerSubscriber);
            broadcaster.subscribe(record, other::add);
            asker.clear();
            other.clear();

            assertTrue(broadcaster.heartbeat(record.id(), askerSubscriber));

            assertEquals(1, asker.size());
            assertEquals(EventType.HEARTBEAT, asker.get(0).type());
            assertTrue(other.isEmpty());
        }

        @Test
        @DisplayName("a failed heartbeat prunes the subscriber")
        void failedHeartbeat() {
            boolean[] broken = {false};
            EventSubscriber subscriber = event -> {
                if (broken[0]) {
                    throw new IOException("gone");
                }
            };
            broadcaster.subscribe(record, subscriber);
            broken[0] = true;

            assertFalse(broadcaster.heartbeat(record.id(), subscriber));
            assertEquals(0, broadcaster.subscriberCount(record.id()));
        }
    }

    @Nested
    @DisplayName("TaskReporter")
    class ReporterTests {

        @Test
        @DisplayName("finish publishes progress then a result with the metrics, only once")
        void finishOnce() {
            List<TaskEvent> received = new ArrayList<>();
            broadcaster.subscribe(record, received::add);
            received.clear();
            reporter.metrics(Map.of("ic", 0.02));
            received.clear();

            assertTrue(reporter.finish(TaskStatus.COMPLETED, "done", p -> p.finished("done")));
            assertFalse(reporter.finish(TaskStatus.FAILED, "late", p -> p.withMessage("late")));

            assertEquals(2, received.size());
            assertEquals(EventType.PROGRESS, received.get(0).type());
            assertEquals(100, ((TaskProgress) received.get(0).data()).percent());
            assertEquals(EventType.RESULT, received.get(1).type());
            @SuppressWarnings("unchecked")
            var data = (Map<String, Object>) received.get(1).data();
            assertEquals(TaskStatus.COMPLETED, data.get("status"));
            assertEquals(Map.of("ic", 0.02), data.get("metrics"));
            assertEquals("done", record.progress().message());
        }

        @Test
        @DisplayName("event types serialize in lower case")
        void wireNames() {
            assertEquals("progress", EventType.PROGRESS.wireName());
            assertEquals("heartbeat", EventType.HEARTBEAT.wireName());
        }
    }
}
