package com.searchnexus.service;

import com.searchnexus.model.LifecycleAction;
import com.searchnexus.model.LifecycleState;
import com.searchnexus.model.NodeConfig;
import com.searchnexus.model.NodeHealth;
import com.searchnexus.model.ProbeResult;
import com.searchnexus.util.ProcessSupervisor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Observed state per node. The running flag always comes from the latest
 * probe; a transitional state is held until the probe agrees with it, and
 * UNREACHABLE is held until the next start/stop command.
 */
@Service
@Slf4j
public class HealthMonitorService {

    private final NodeRegistry registry;
    private final ProcessSupervisor supervisor;
    private final Map<String, NodeHealth> nodeHealthCache = new ConcurrentHashMap<>();

    public HealthMonitorService(NodeRegistry registry, ProcessSupervisor supervisor) {
        this.registry = registry;
        this.supervisor = supervisor;
    }

    @Scheduled(fixedDelayString = "${nexus.monitor.refresh-interval:15s}")
    public void refreshAll() {
        for (NodeConfig node : registry.snapshot()) {
            refresh(node);
        }
    }

    public NodeHealth refresh(NodeConfig node) {
        ProbeResult probe;
        boolean probeFailed = false;
        try {
            probe = supervisor.healthProbe(node);
        } catch (RuntimeException e) {
            log.warn("Health probe of node {} failed: {}", node.getName(), e.getMessage());
            probe = ProbeResult.stopped();
            probeFailed = true;
        }
        ProbeResult observed = probe;
        boolean failed = probeFailed;
        return nodeHealthCache.compute(node.getName(), (name, previous) -> {
            NodeHealth health = previous != null ? previous : NodeHealth.unknown(name);
            health.setRunning(observed.isRunning());
            health.setPid(observed.getPid());
            health.setLastCheckTime(System.currentTimeMillis());
            health.setConsecutiveFailures(failed ? health.getConsecutiveFailures() + 1 : 0);
            health.setState(nextState(health.getState(), observed.isRunning()));
            return health;
        }).copy();
    }

    static LifecycleState nextState(LifecycleState current, boolean running) {
        switch (current) {
            case STARTING:
                return running ? LifecycleState.RUNNING : LifecycleState.STARTING;
            case STOPPING:
                return running ? LifecycleState.STOPPING : LifecycleState.STOPPED;
            case UNREACHABLE:
                return LifecycleState.UNREACHABLE;
            default:
                return running ? LifecycleState.RUNNING : LifecycleState.STOPPED;
        }
    }

    public void markTransition(String nodeName, LifecycleAction action) {
        setState(nodeName, action.getTransitionalState());
    }

    public void settle(String nodeName, LifecycleAction action) {
        setState(nodeName, action.getSettledState());
    }

    public void markUnreachable(String nodeName) {
        setState(nodeName, LifecycleState.UNREACHABLE);
        log.warn("Node {} marked unreachable", nodeName);
    }

    private void setState(String nodeName, LifecycleState state) {
        nodeHealthCache.compute(nodeName, (name, previous) -> {
            NodeHealth health = previous != null ? previous : NodeHealth.unknown(name);
            health.setState(state);
            return health;
        });
    }

    public NodeHealth get(String nodeName) {
        NodeHealth health = nodeHealthCache.get(nodeName);
        return health != null ? health.copy() : NodeHealth.unknown(nodeName);
    }

    public void forget(String nodeName) {
        nodeHealthCache.remove(nodeName);
    }
}
