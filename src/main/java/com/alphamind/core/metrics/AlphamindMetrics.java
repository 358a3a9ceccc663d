package com.alphamind.core.metrics;

import com.alphamind.core.model.TaskKind;
import com.alphamind.core.model.TaskStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Locale;

/**
 * Centralised Micrometer metrics for trial supervision.
 */
@Service
public class AlphamindMetrics {

    private final MeterRegistry registry;

    public AlphamindMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTrialDuration(TaskKind kind, long ms) {
        Timer.builder("alphamind.trial.duration")
                .tag("kind", tag(kind))
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordTaskResult(TaskKind kind, TaskStatus status) {
        Counter.builder("alphamind.tasks.total")
                .tag("kind", tag(kind))
                .tag("status", tag(status))
                .register(registry)
                .increment();
    }

    /**
     * Records the outcome of one branch of a mining task.
     */
    public void recordBranchResult(boolean succeeded) {
        Counter.builder("alphamind.branches.total")
                .description("Mining branches by outcome")
                .tag("result", succeeded ? "succeeded" : "failed")
                .register(registry)
                .increment();
    }

    public void recordTimeout(TaskKind kind) {
        Counter.builder("alphamind.trial.timeouts")
                .description("Trials killed by their deadline")
                .tag("kind", tag(kind))
                .register(registry)
                .increment();
    }

    public void recordLaunchFailure(TaskKind kind) {
        Counter.builder("alphamind.trial.launch_failures")
                .tag("kind", tag(kind))
                .register(registry)
                .increment();
    }

    /**
     * Records a subscriber dropped after a failed delivery.
     */
    public void recordPrunedSubscriber() {
        Counter.builder("alphamind.subscribers.pruned")
                .register(registry)
                .increment();
    }

    private static String tag(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT);
    }
}
