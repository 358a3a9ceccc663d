package com.alphamind.dispatch.api;

import com.alphamind.core.engine.TaskService;
import com.alphamind.trial.TrialExecutor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST controller for service liveness.
 */
@RestController
@RequestMapping("/api/v1/health")
public class HealthController {

    private final TaskService taskService;
    private final TrialExecutor trialExecutor;

    public HealthController(TaskService taskService, TrialExecutor trialExecutor) {
        this.taskService = taskService;
        this.trialExecutor = trialExecutor;
    }

    /**
     * GET /api/v1/health: Always UP while the process serves requests.
     */
    @GetMapping
    public Map<String, Object> health() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status", "UP");
        result.put("timestamp", Instant.now().toString());
        result.put("runningTasks", taskService.runningCount());
        result.put("executor", trialExecutor.getClass().getSimpleName());
        return result;
    }
}
