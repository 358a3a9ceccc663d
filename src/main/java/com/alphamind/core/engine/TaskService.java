package com.alphamind.core.engine;

import com.alphamind.core.events.EventBroadcaster;
import com.alphamind.core.events.TaskReporter;
import com.alphamind.core.logging.MdcContext;
import com.alphamind.core.model.BacktestRequest;
import com.alphamind.core.model.MiningRequest;
import com.alphamind.core.model.Phase;
import com.alphamind.core.model.TaskKind;
import com.alphamind.core.model.TaskProgress;
import com.alphamind.core.model.TaskSnapshot;
import com.alphamind.core.model.TaskStatus;
import com.alphamind.core.registry.TaskNotFoundException;
import com.alphamind.core.registry.TaskRecord;
import com.alphamind.core.registry.TaskRegistry;
import com.alphamind.trial.TrialHandle;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lifecycle API for supervised tasks: start, inspect, cancel and list.
 * <p>
 * {@code start*} returns as soon as the task is registered; each task is supervised on its own
 * background thread and never blocks the caller.
 */
@Service
public class TaskService {

    private static final Logger log = LoggerFactory.getLogger(TaskService.class);

    private static final TypeReference<Map<String, Object>> CONFIG_TYPE = new TypeReference<>() {};

    private final TaskRegistry registry;
    private final TrialSupervisor supervisor;
    private final EventBroadcaster broadcaster;
    private final ObjectMapper objectMapper;
    private final ExecutorService executor;

    /** Tracks running supervision futures, keyed by taskId. */
    private final ConcurrentHashMap<String, CompletableFuture<Void>> running = new ConcurrentHashMap<>();

    public TaskService(TaskRegistry registry, TrialSupervisor supervisor, EventBroadcaster broadcaster,
                       ObjectMapper objectMapper) {
        this.registry = registry;
        this.supervisor = supervisor;
        this.broadcaster = broadcaster;
        this.objectMapper = objectMapper;
        var counter = new AtomicInteger();
        // unbounded: every task gets its own supervising thread as soon as it is accepted
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "task-supervisor-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public TaskSnapshot startMining(MiningRequest request) {
        TaskRecord record = registry.create(TaskKind.MINING, toConfig(request),
                TaskProgress.initial(Phase.PLANNING, request.effectiveMaxRounds(), "Starting experiment..."));
        log.info("Accepted mining task {}", record.id());
        submit(record, () -> supervisor.superviseMining(record, request));
        return record.snapshot();
    }

    /**
     * @throws IllegalArgumentException if the request names no factor library
     */
    public TaskSnapshot startBacktest(BacktestRequest request) {
        if (request.factorJson() == null || request.factorJson().isBlank()) {
            throw new IllegalArgumentException("factorJson is required");
        }
        TaskRecord record = registry.create(TaskKind.BACKTEST, toConfig(request),
                TaskProgress.initial(Phase.BACKTESTING, 0, "Starting backtest..."));
        log.info("Accepted backtest task {} for {}", record.id(), request.factorJson());
        submit(record, () -> supervisor.superviseBacktest(record, request));
        return record.snapshot();
    }

    /**
     * Starts a task from loosely typed parameters, as received by the CLI or a generic client.
     *
     * @return the new task id
     * @throws IllegalArgumentException if the parameters do not describe a valid request
     */
    public String start(TaskKind kind, Map<String, Object> params) {
        Map<String, Object> source = params == null ? Map.of() : params;
        return switch (kind) {
            case MINING -> startMining(objectMapper.convertValue(source, MiningRequest.class)).taskId();
            case BACKTEST -> startBacktest(objectMapper.convertValue(source, BacktestRequest.class)).taskId();
        };
    }

    /**
     * @throws TaskNotFoundException if the id is unknown
     */
    public TaskSnapshot get(String taskId) {
        return registry.get(taskId).snapshot();
    }

    /**
     * Live record of a task, for attaching event subscribers.
     *
     * @throws TaskNotFoundException if the id is unknown
     */
    public TaskRecord record(String taskId) {
        return registry.get(taskId);
    }

    public Optional<TaskRecord> findRecord(String taskId) {
        return registry.find(taskId);
    }

    /**
     * Signals the task's live processes and marks it CANCELLED. Idempotent: a task that is
     * already terminal keeps its status.
     *
     * @throws TaskNotFoundException if the id is unknown
     */
    public TaskSnapshot cancel(String taskId) {
        TaskRecord record = registry.get(taskId);
        var reporter = new TaskReporter(record, broadcaster);
        synchronized (record) {
            if (record.isTerminal()) {
                log.debug("Cancel of task {} ignored, already {}", taskId, record.status());
                return record.snapshot();
            }
            for (TrialHandle handle : record.liveProcesses()) {
                log.info("Terminating process {} of task {}", handle.pid(), taskId);
                handle.terminate();
            }
            reporter.finish(TaskStatus.CANCELLED, "Cancelled by user", p -> p.withMessage("Cancelled by user"));
        }
        log.info("Cancelled task {}", taskId);
        return record.snapshot();
    }

    /**
     * All tasks, newest first.
     */
    public List<TaskSnapshot> list() {
        return registry.list().stream().map(TaskRecord::snapshot).toList();
    }

    public int runningCount() {
        return running.size();
    }

    @PreDestroy
    void shutdown() {
        for (TaskRecord record : registry.list()) {
            for (TrialHandle handle : record.liveProcesses()) {
                log.info("Shutting down: killing process {} of task {}", handle.pid(), record.id());
                handle.kill();
            }
        }
        executor.shutdownNow();
    }

    private void submit(TaskRecord record, Runnable supervision) {
        CompletableFuture<Void> future = CompletableFuture.runAsync(() -> {
            MdcContext.setTask(record.id(), record.kind());
            try {
                supervision.run();
            } finally {
                MdcContext.clear();
            }
        }, executor);
        running.put(record.id(), future);
        // runs inline if the supervision already finished, so the entry never outlives it
        future.whenComplete((ignored, error) -> running.remove(record.id(), future));
    }

    private Map<String, Object> toConfig(Object request) {
        return objectMapper.convertValue(request, CONFIG_TYPE);
    }
}
