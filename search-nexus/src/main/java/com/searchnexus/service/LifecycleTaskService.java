package com.searchnexus.service;

import com.searchnexus.config.NexusProperties;
import com.searchnexus.exception.NexusErrorCode;
import com.searchnexus.exception.NexusException;
import com.searchnexus.model.LifecycleAction;
import com.searchnexus.model.LifecycleTask;
import com.searchnexus.model.ReconcileOutcome;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Progress records for start/stop commands. Finished tasks stay readable for
 * the configured retention, then disappear.
 */
@Service
public class LifecycleTaskService {

    private final Map<String, LifecycleTask> tasks = new ConcurrentHashMap<>();
    private final NexusProperties properties;

    public LifecycleTaskService(NexusProperties properties) {
        this.properties = properties;
    }

    public LifecycleTask create(String nodeName, LifecycleAction action, String sessionId, int maxAttempts) {
        LifecycleTask task = new LifecycleTask();
        task.setTaskId(UUID.randomUUID().toString());
        task.setNodeName(nodeName);
        task.setAction(action);
        task.setSessionId(sessionId);
        task.setStatus("accepted");
        task.setMaxAttempts(maxAttempts);
        task.setStartTime(System.currentTimeMillis());
        task.setMessage(action == LifecycleAction.START ? "Start command accepted" : "Stop command accepted");
        tasks.put(task.getTaskId(), task);
        return snapshot(task);
    }

    public void progress(String taskId, int attempt) {
        LifecycleTask task = tasks.get(taskId);
        if (task != null) {
            synchronized (task) {
                if (!task.isFinished()) {
                    task.setStatus("polling");
                    task.setAttempt(attempt);
                }
            }
        }
    }

    /** Records the terminal outcome. Only the first call for a task takes effect. */
    public void complete(String taskId, ReconcileOutcome outcome, String errorCode, String message) {
        LifecycleTask task = tasks.get(taskId);
        if (task == null) {
            return;
        }
        synchronized (task) {
            if (task.isFinished()) {
                return;
            }
            task.setOutcome(outcome);
            task.setStatus(statusOf(outcome));
            task.setErrorCode(errorCode);
            task.setMessage(message);
            task.setEndTime(System.currentTimeMillis());
        }
        long retention = properties.getReconcile().getTaskRetention().toMillis();
        CompletableFuture.delayedExecutor(retention, TimeUnit.MILLISECONDS).execute(() -> tasks.remove(taskId));
    }

    public LifecycleTask get(String taskId) {
        LifecycleTask task = tasks.get(taskId);
        if (task == null) {
            throw new NexusException(NexusErrorCode.TASK_NOT_FOUND, "Task \"" + taskId + "\" not found")
                    .with("taskId", taskId);
        }
        return snapshot(task);
    }

    private static String statusOf(ReconcileOutcome outcome) {
        switch (outcome) {
            case CONVERGED:
                return "completed";
            case TIMED_OUT:
                return "timed_out";
            default:
                return "cancelled";
        }
    }

    private static LifecycleTask snapshot(LifecycleTask task) {
        synchronized (task) {
            LifecycleTask copy = new LifecycleTask();
            copy.setTaskId(task.getTaskId());
            copy.setNodeName(task.getNodeName());
            copy.setAction(task.getAction());
            copy.setSessionId(task.getSessionId());
            copy.setStatus(task.getStatus());
            copy.setAttempt(task.getAttempt());
            copy.setMaxAttempts(task.getMaxAttempts());
            copy.setOutcome(task.getOutcome());
            copy.setErrorCode(task.getErrorCode());
            copy.setMessage(task.getMessage());
            copy.setStartTime(task.getStartTime());
            copy.setEndTime(task.getEndTime());
            return copy;
        }
    }
}
