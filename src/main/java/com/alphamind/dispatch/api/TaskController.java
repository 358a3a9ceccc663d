package com.alphamind.dispatch.api;

import com.alphamind.core.engine.TaskService;
import com.alphamind.core.model.BacktestRequest;
import com.alphamind.core.model.MiningRequest;
import com.alphamind.core.model.TaskSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;

/**
 * REST controller for mining and backtest task lifecycle operations.
 */
@RestController
@RequestMapping("/api/v1")
public class TaskController {

    private static final Logger log = LoggerFactory.getLogger(TaskController.class);

    private final TaskService taskService;
    private final SseStreamingService sseStreamingService;

    public TaskController(TaskService taskService, SseStreamingService sseStreamingService) {
        this.taskService = taskService;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * POST /api/v1/mining/start: Start a factor-mining task. Runs asynchronously.
     */
    @PostMapping("/mining/start")
    public ResponseEntity<ApiResponse<TaskStarted>> startMining(@RequestBody MiningRequest request) {
        TaskSnapshot task = taskService.startMining(request);
        log.info("Started mining task {}", task.taskId());
        return ResponseEntity.accepted().body(ApiResponse.ok(new TaskStarted(task.taskId(), task), "Mining started"));
    }

    /**
     * POST /api/v1/backtest/start: Start a standalone backtest. Runs asynchronously.
     */
    @PostMapping("/backtest/start")
    public ResponseEntity<ApiResponse<TaskStarted>> startBacktest(@RequestBody BacktestRequest request) {
        if (request.factorJson() == null || request.factorJson().isBlank()) {
            return ResponseEntity.badRequest().body(ApiResponse.error("factorJson is required"));
        }
        TaskSnapshot task = taskService.startBacktest(request);
        log.info("Started backtest task {}", task.taskId());
        return ResponseEntity.accepted().body(ApiResponse.ok(new TaskStarted(task.taskId(), task), "Backtest started"));
    }

    /**
     * GET /api/v1/tasks: All tasks, newest first.
     */
    @GetMapping("/tasks")
    public ApiResponse<List<TaskSnapshot>> listTasks() {
        return ApiResponse.ok(taskService.list());
    }

    /**
     * GET /api/v1/tasks/{id}: Task snapshot. The mining and backtest paths are aliases.
     */
    @GetMapping({"/tasks/{id}", "/mining/{id}", "/backtest/{id}"})
    public ApiResponse<TaskSnapshot> getTask(@PathVariable("id") String id) {
        return ApiResponse.ok(taskService.get(id));
    }

    /**
     * DELETE /api/v1/tasks/{id}: Cancel a task. Cancelling a finished task is a no-op.
     */
    @DeleteMapping({"/tasks/{id}", "/mining/{id}", "/backtest/{id}"})
    public ApiResponse<TaskSnapshot> cancelTask(@PathVariable("id") String id) {
        TaskSnapshot task = taskService.cancel(id);
        return ApiResponse.ok(task, "Task " + id + " is " + task.status());
    }

    /**
     * GET /api/v1/tasks/{id}/events: SSE stream of task events.
     */
    @GetMapping(value = "/tasks/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> streamEvents(@PathVariable("id") String id) {
        return taskService.findRecord(id)
                .map(record -> ResponseEntity.ok(sseStreamingService.createEmitter(record)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
