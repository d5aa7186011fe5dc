package com.searchnexus.controller;

import com.searchnexus.model.LifecycleTask;
import com.searchnexus.service.LifecycleTaskService;
import com.searchnexus.service.NodeOrchestrator;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api")
public class LifecycleController {

    @Autowired
    private LifecycleTaskService taskService;

    @Autowired
    private NodeOrchestrator orchestrator;

    @GetMapping("/tasks/{taskId}")
    public LifecycleTask getTask(@PathVariable String taskId) {
        return taskService.get(taskId);
    }

    // the process commands already issued keep running; only the waits stop
    @DeleteMapping("/sessions/{sessionId}")
    public Map<String, Object> closeSession(@PathVariable String sessionId) {
        int cancelled = orchestrator.cancelSession(sessionId);
        return Map.of(
                "sessionId", sessionId,
                "cancelledWaits", cancelled
        );
    }
}
