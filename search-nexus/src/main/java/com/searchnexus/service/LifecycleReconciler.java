package com.searchnexus.service;

import com.searchnexus.config.NexusProperties;
import com.searchnexus.exception.GuardViolationException;
import com.searchnexus.exception.NexusErrorCode;
import com.searchnexus.model.LifecycleAction;
import com.searchnexus.model.LifecycleState;
import com.searchnexus.model.LifecycleTask;
import com.searchnexus.model.NodeConfig;
import com.searchnexus.model.NodeHealth;
import com.searchnexus.model.ReconcileOutcome;
import com.searchnexus.model.ReconcileResult;
import com.searchnexus.util.KeyedLocks;
import com.searchnexus.util.ProcessSupervisor;
import com.searchnexus.util.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Drives a node towards the state asked for by a start/stop command. The
 * command is issued synchronously; the wait for convergence runs on the
 * reconcile executor, at most one per node.
 */
@Slf4j
@Service
public class LifecycleReconciler {

    private final ProcessSupervisor supervisor;
    private final HealthMonitorService monitor;
    private final LifecycleTaskService tasks;
    private final TaskExecutor executor;
    private final Sleeper sleeper;
    private final NexusProperties properties;
    private final KeyedLocks commandLocks = new KeyedLocks();
    private final Map<String, InFlight> inFlight = new ConcurrentHashMap<>();

    public LifecycleReconciler(ProcessSupervisor supervisor, HealthMonitorService monitor, LifecycleTaskService tasks,
                               @Qualifier("reconcileExecutor") TaskExecutor executor, Sleeper sleeper,
                               NexusProperties properties) {
        this.supervisor = supervisor;
        this.monitor = monitor;
        this.tasks = tasks;
        this.executor = executor;
        this.sleeper = sleeper;
        this.properties = properties;
    }

    public LifecycleTask start(NodeConfig node, String sessionId) {
        return issue(node, LifecycleAction.START, sessionId);
    }

    public LifecycleTask stop(NodeConfig node, String sessionId) {
        return issue(node, LifecycleAction.STOP, sessionId);
    }

    private LifecycleTask issue(NodeConfig node, LifecycleAction action, String sessionId) {
        String name = node.getName();
        return commandLocks.withLock(name, () -> {
            InFlight existing = inFlight.get(name);
            if (existing != null) {
                if (existing.action == action) {
                    log.info("{} of node {} already in progress, joining task {}", action, name, existing.taskId);
                    return tasks.get(existing.taskId);
                }
                log.warn("Rejected {} of node {}: {} still in progress", action, name, existing.action);
                throw new GuardViolationException(name, existing.action.getTransitionalState());
            }

            NodeHealth observed = monitor.refresh(node);
            if (observed.isRunning() == action.isDesiredRunning()) {
                monitor.settle(name, action);
                LifecycleTask task = tasks.create(name, action, sessionId, 0);
                tasks.complete(task.getTaskId(), ReconcileOutcome.CONVERGED, null,
                        "Node " + name + " is already " + action.getSettledState().name().toLowerCase());
                return tasks.get(task.getTaskId());
            }

            if (action == LifecycleAction.START) {
                supervisor.launch(node);
            } else {
                supervisor.terminate(node);
            }
            monitor.markTransition(name, action);
            LifecycleTask task = tasks.create(name, action, sessionId, attempts(action));
            InFlight entry = new InFlight(action, task.getTaskId(), sessionId);
            inFlight.put(name, entry);
            log.info("{} command accepted for node {} (task {})", action, name, task.getTaskId());
            try {
                executor.execute(() -> reconcile(node, action, entry));
            } catch (RuntimeException e) {
                inFlight.remove(name, entry);
                throw e;
            }
            return task;
        });
    }

    /**
     * Polls until the observed running flag matches {@code action}, the attempt
     * budget runs out, or the wait is cancelled. Never throws for a timeout.
     */
    ReconcileResult reconcile(NodeConfig node, LifecycleAction action, InFlight entry) {
        String name = node.getName();
        int maxAttempts = attempts(action);
        Duration interval = interval(action);
        int attempt = 0;
        ReconcileResult result = null;
        entry.attach(Thread.currentThread());
        try {
            while (result == null && attempt < maxAttempts) {
                entry.checkCancelled();
                sleeper.sleep(interval);
                entry.checkCancelled();
                attempt++;
                tasks.progress(entry.taskId, attempt);
                NodeHealth health = monitor.refresh(node);
                if (health.isRunning() == action.isDesiredRunning()) {
                    monitor.settle(name, action);
                    log.info("Node {} reached {} after {} attempt(s)", name, action.getSettledState(), attempt);
                    tasks.complete(entry.taskId, ReconcileOutcome.CONVERGED, null,
                            "Node " + name + " is " + action.getSettledState().name().toLowerCase());
                    result = new ReconcileResult(name, action, ReconcileOutcome.CONVERGED, attempt, health.isRunning());
                }
            }
            if (result == null) {
                result = finalRefresh(node, action, entry, attempt);
            }
        } catch (InterruptedException e) {
            log.info("Wait for {} of node {} cancelled after {} attempt(s)", action, name, attempt);
            tasks.complete(entry.taskId, ReconcileOutcome.CANCELLED, null,
                    "Wait cancelled; the " + action.name().toLowerCase() + " command was already issued");
            result = new ReconcileResult(name, action, ReconcileOutcome.CANCELLED, attempt,
                    monitor.get(name).isRunning());
        } catch (RuntimeException e) {
            log.error("Reconciliation of node {} failed", name, e);
            tasks.complete(entry.taskId, ReconcileOutcome.CANCELLED, NexusErrorCode.INTERNAL_ERROR.getCode(),
                    e.getMessage());
            entry.result.completeExceptionally(e);
            throw e;
        } finally {
            entry.detach();
            inFlight.remove(name, entry);
        }
        entry.result.complete(result);
        return result;
    }

    private ReconcileResult finalRefresh(NodeConfig node, LifecycleAction action, InFlight entry, int attempt) {
        String name = node.getName();
        int maxAttempts = attempts(action);
        NodeHealth last = monitor.refresh(node);
        if (last.isRunning() == action.isDesiredRunning()) {
            monitor.settle(name, action);
            tasks.complete(entry.taskId, ReconcileOutcome.CONVERGED, null,
                    "Node " + name + " is " + action.getSettledState().name().toLowerCase());
            return new ReconcileResult(name, action, ReconcileOutcome.CONVERGED, attempt, last.isRunning());
        }
        monitor.markUnreachable(name);
        log.warn("Node {} did not reach {} within {} attempt(s)", name, action.getSettledState(), maxAttempts);
        tasks.complete(entry.taskId, ReconcileOutcome.TIMED_OUT, NexusErrorCode.RECONCILIATION_TIMEOUT.getCode(),
                "Node " + name + " did not become " + action.getSettledState().name().toLowerCase()
                        + " within " + maxAttempts + " attempts; check the node logs");
        return new ReconcileResult(name, action, ReconcileOutcome.TIMED_OUT, attempt, last.isRunning());
    }

    /**
     * Rejects mutation of a node that is mid-reconciliation or observed running.
     */
    public void assertQuiescent(NodeConfig node) {
        InFlight entry = inFlight.get(node.getName());
        if (entry != null) {
            throw new GuardViolationException(node.getName(), entry.action.getTransitionalState());
        }
        if (monitor.refresh(node).isRunning()) {
            log.warn("Rejected change to running node {}", node.getName());
            throw new GuardViolationException(node.getName(), LifecycleState.RUNNING);
        }
    }

    public Optional<CompletableFuture<ReconcileResult>> inFlightResult(String nodeName) {
        return Optional.ofNullable(inFlight.get(nodeName)).map(entry -> entry.result);
    }

    /** Cancels the waits started by {@code sessionId}. Issued commands are left alone. */
    public int cancelSession(String sessionId) {
        int cancelled = 0;
        for (InFlight entry : inFlight.values()) {
            if (Objects.equals(sessionId, entry.sessionId)) {
                entry.cancel();
                cancelled++;
            }
        }
        if (cancelled > 0) {
            log.info("Cancelled {} reconciliation wait(s) of session {}", cancelled, sessionId);
        }
        return cancelled;
    }

    private int attempts(LifecycleAction action) {
        NexusProperties.Reconcile reconcile = properties.getReconcile();
        return action == LifecycleAction.START ? reconcile.getStartAttempts() : reconcile.getStopAttempts();
    }

    private Duration interval(LifecycleAction action) {
        NexusProperties.Reconcile reconcile = properties.getReconcile();
        return action == LifecycleAction.START ? reconcile.getStartInterval() : reconcile.getStopInterval();
    }

    static final class InFlight {
        private final LifecycleAction action;
        private final String taskId;
        private final String sessionId;
        private final CompletableFuture<ReconcileResult> result = new CompletableFuture<>();
        private boolean cancelled;
        private Thread worker;

        InFlight(LifecycleAction action, String taskId, String sessionId) {
            this.action = action;
            this.taskId = taskId;
            this.sessionId = sessionId;
        }

        synchronized void attach(Thread thread) {
            this.worker = thread;
        }

        // cleared before the worker returns to the pool so a late cancel cannot interrupt another task
        synchronized void detach() {
            this.worker = null;
            Thread.interrupted();
        }

        synchronized void cancel() {
            cancelled = true;
            if (worker != null) {
                worker.interrupt();
            }
        }

        synchronized void checkCancelled() throws InterruptedException {
            if (cancelled) {
                throw new InterruptedException("cancelled");
            }
        }
    }
}
