package com.searchnexus.service;

import com.searchnexus.config.NexusProperties;
import com.searchnexus.dto.CopyRequest;
import com.searchnexus.dto.MoveRequest;
import com.searchnexus.dto.NodeConfigRequest;
import com.searchnexus.exception.ConflictException;
import com.searchnexus.exception.NexusErrorCode;
import com.searchnexus.exception.NexusException;
import com.searchnexus.model.CopyResult;
import com.searchnexus.model.DeleteResult;
import com.searchnexus.model.LifecycleTask;
import com.searchnexus.model.MoveResult;
import com.searchnexus.model.NodeConfig;
import com.searchnexus.model.NodeHealth;
import com.searchnexus.model.NodeRoles;
import com.searchnexus.model.NodeStatus;
import com.searchnexus.model.RepairReport;
import com.searchnexus.model.ValidationMode;
import com.searchnexus.model.ValidationResult;
import com.searchnexus.util.KeyedLocks;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Sequences validation, filesystem work, registry commits and lifecycle
 * commands for every operator action on a single node. Mutations hold the
 * node's lock; a registry commit that fails after filesystem work undoes
 * that work before the error propagates.
 */
@Slf4j
@Service
public class NodeOrchestrator {

    private static final Pattern NODE_NAME = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9._-]*$");

    private final NodeRegistry registry;
    private final NodeConfigValidator validator;
    private final NodeMaterializer materializer;
    private final LifecycleReconciler reconciler;
    private final HealthMonitorService monitor;
    private final NexusProperties properties;
    private final AsyncTaskExecutor validationExecutor;
    private final KeyedLocks nodeLocks;

    public NodeOrchestrator(NodeRegistry registry, NodeConfigValidator validator, NodeMaterializer materializer,
                            LifecycleReconciler reconciler, HealthMonitorService monitor, NexusProperties properties,
                            @Qualifier("validationExecutor") AsyncTaskExecutor validationExecutor,
                            KeyedLocks nodeLocks) {
        this.registry = registry;
        this.validator = validator;
        this.materializer = materializer;
        this.reconciler = reconciler;
        this.monitor = monitor;
        this.properties = properties;
        this.validationExecutor = validationExecutor;
        this.nodeLocks = nodeLocks;
    }

    public ValidationResult validate(NodeConfigRequest request, String originalName) {
        if (request == null) {
            throw invalid("nodeConfig is required");
        }
        if (originalName != null && registry.find(originalName).isPresent()) {
            NodeConfig candidate = merge(registry.get(originalName), request);
            return timedValidation(candidate, ValidationMode.UPDATE, originalName);
        }
        return timedValidation(withDefaults(request), ValidationMode.CREATE, null);
    }

    public NodeStatus create(NodeConfigRequest request) {
        NodeConfig candidate = withDefaults(request);
        return nodeLocks.withLocks(lockKeys(candidate.getName(), null, candidate), () -> {
            requireValid(candidate, ValidationMode.CREATE, null);
            NodeFootprint footprint = materializer.materialize(candidate);
            try {
                registry.commit(candidate, null, nodes -> validator.validate(candidate, ValidationMode.CREATE, null, nodes));
            } catch (RuntimeException e) {
                materializer.rollback(footprint);
                throw e;
            }
            log.info("Created node {} in cluster {} (http {}, transport {})", candidate.getName(),
                    candidate.getCluster(), candidate.getHttpPort(), candidate.getTransportPort());
            return NodeStatus.of(candidate, monitor.refresh(candidate));
        });
    }

    public NodeStatus update(String name, NodeConfigRequest request) {
        if (request == null) {
            throw invalid("Request body is required");
        }
        String newName = request.getName() != null ? request.getName() : name;
        List<String> keys = new ArrayList<>(List.of(name, newName));
        keys.add(pathKey(blankToNull(request.getDataPath())));
        keys.add(pathKey(blankToNull(request.getLogsPath())));
        return nodeLocks.withLocks(keys, () -> {
            NodeConfig current = registry.get(name);
            reconciler.assertQuiescent(current);
            NodeConfig updated = merge(current, request);
            requireValid(updated, ValidationMode.UPDATE, name);
            NodeFootprint footprint = materializer.applyUpdate(current, updated);
            try {
                registry.commit(updated, name, nodes -> validator.validate(updated, ValidationMode.UPDATE, name, nodes));
            } catch (RuntimeException e) {
                materializer.rollback(footprint);
                restoreConfig(current);
                throw e;
            }
            if (!name.equals(updated.getName())) {
                monitor.forget(name);
            }
            log.info("Updated node {}{}", name, name.equals(updated.getName()) ? "" : " (now " + updated.getName() + ")");
            return NodeStatus.of(updated, monitor.refresh(updated));
        });
    }

    public NodeStatus changeCluster(String name, String cluster) {
        if (cluster == null || cluster.isBlank()) {
            throw invalid("cluster is required");
        }
        NodeConfigRequest request = new NodeConfigRequest();
        request.setCluster(cluster.trim());
        return update(name, request);
    }

    public MoveResult move(String name, MoveRequest request) {
        if (request == null || request.getTargetBasePath() == null || request.getTargetBasePath().isBlank()) {
            throw invalid("targetBasePath is required");
        }
        if (request.getPreserveData() == null) {
            throw invalid("preserveData must be set explicitly; false discards the node's data");
        }
        boolean preserveData = request.getPreserveData();
        NodeConfig layout = new NodeConfig();
        layout.setName(name);
        List<String> keys = lockKeys(name, null, NodeMaterializer.withLayout(layout, request.getTargetBasePath()));
        return nodeLocks.withLocks(keys, () -> {
            NodeConfig current = registry.get(name);
            reconciler.assertQuiescent(current);
            NodeConfig target = NodeMaterializer.withLayout(current, request.getTargetBasePath());
            if (Paths.get(target.getConfigPath()).equals(Paths.get(current.getConfigPath()).toAbsolutePath().normalize())) {
                throw invalid("Node " + name + " is already located under " + request.getTargetBasePath());
            }
            requireValid(target, ValidationMode.UPDATE, name);
            NodeFootprint footprint = materializer.relocate(current, target, preserveData);
            try {
                registry.commit(target, name, nodes -> validator.validate(target, ValidationMode.UPDATE, name, nodes));
            } catch (RuntimeException e) {
                materializer.rollback(footprint);
                throw e;
            }
            List<String> warnings = materializer.removeNodeFiles(current, false);
            log.info("Moved node {} to {} (preserveData={})", name, request.getTargetBasePath(), preserveData);
            return new MoveResult(name, NodeStatus.of(target, monitor.refresh(target)), preserveData, warnings);
        });
    }

    public CopyResult copy(String name, CopyRequest request) {
        if (request == null) {
            throw invalid("Request body is required");
        }
        String newName = requireName(request.getNewName());
        String basePath = request.getTargetBasePath() == null || request.getTargetBasePath().isBlank()
                ? properties.getBasePath() : request.getTargetBasePath();
        NodeConfig layout = new NodeConfig();
        layout.setName(newName);
        List<String> keys = lockKeys(name, newName, NodeMaterializer.withLayout(layout, basePath));
        return nodeLocks.withLocks(keys, () -> {
            NodeConfig source = registry.get(name);
            List<String> warnings = new ArrayList<>();
            if (request.isCopyData() && monitor.refresh(source).isRunning()) {
                log.warn("Copying data of running node {}; the copy may be inconsistent", name);
                warnings.add("Source node " + name + " was running; copied data may be inconsistent");
            }
            NodeConfig candidate = source.copy();
            candidate.setName(newName);
            candidate = NodeMaterializer.withLayout(candidate, basePath);
            if (request.getHttpPort() == null || request.getTransportPort() == null) {
                List<Integer> supplied = new ArrayList<>();
                if (request.getHttpPort() != null) {
                    supplied.add(request.getHttpPort());
                }
                if (request.getTransportPort() != null) {
                    supplied.add(request.getTransportPort());
                }
                int[] ports = validator.suggestFreePorts(source.getHttpPort(), source.getTransportPort(),
                        registry.snapshot(), supplied);
                candidate.setHttpPort(request.getHttpPort() != null ? checkPort(request.getHttpPort()) : ports[0]);
                candidate.setTransportPort(request.getTransportPort() != null
                        ? checkPort(request.getTransportPort()) : ports[1]);
            } else {
                candidate.setHttpPort(checkPort(request.getHttpPort()));
                candidate.setTransportPort(checkPort(request.getTransportPort()));
            }
            NodeConfig copy = candidate;
            requireValid(copy, ValidationMode.CREATE, null);
            NodeFootprint footprint = materializer.duplicate(source, copy, request.isCopyData());
            try {
                registry.commit(copy, null, nodes -> validator.validate(copy, ValidationMode.CREATE, null, nodes));
            } catch (RuntimeException e) {
                materializer.rollback(footprint);
                throw e;
            }
            log.info("Copied node {} to {} (copyData={})", name, newName, request.isCopyData());
            return new CopyResult(name, NodeStatus.of(copy, monitor.refresh(copy)), request.isCopyData(), warnings);
        });
    }

    public LifecycleTask start(String name, String sessionId) {
        return nodeLocks.withLock(name, () -> reconciler.start(registry.get(name), sessionId));
    }

    public LifecycleTask stop(String name, String sessionId) {
        return nodeLocks.withLock(name, () -> reconciler.stop(registry.get(name), sessionId));
    }

    public DeleteResult delete(String name, boolean preserveData) {
        return nodeLocks.withLock(name, () -> {
            NodeConfig current = registry.get(name);
            reconciler.assertQuiescent(current);
            registry.remove(name);
            monitor.forget(name);
            List<String> warnings = materializer.removeNodeFiles(current, preserveData);
            log.info("Deleted node {} (preserveData={})", name, preserveData);
            return new DeleteResult(name, preserveData, warnings);
        });
    }

    public List<NodeStatus> listNodes(boolean refresh) {
        return registry.snapshot().stream()
                .map(node -> NodeStatus.of(node, refresh ? monitor.refresh(node) : monitor.get(node.getName())))
                .collect(Collectors.toList());
    }

    public NodeStatus getNode(String name) {
        NodeConfig node = registry.get(name);
        return NodeStatus.of(node, monitor.refresh(node));
    }

    public String readConfig(String name) {
        return materializer.readConfigFile(registry.get(name));
    }

    /**
     * Drops registrations whose data or logs directory vanished and re-renders
     * missing configuration files for the rest.
     */
    public RepairReport repairAndVerify() {
        RepairReport report = new RepairReport();
        for (NodeConfig node : registry.snapshot()) {
            nodeLocks.withLock(node.getName(), () -> {
                NodeHealth health = monitor.get(node.getName());
                if (!materializer.hasStorageDirectories(node) && !health.isRunning()) {
                    registry.remove(node.getName());
                    monitor.forget(node.getName());
                    materializer.removeNodeFiles(node, false);
                    log.warn("Removed node {}: its data or logs directory is missing", node.getName());
                    report.getRemoved().add(node.getName());
                } else if (!materializer.hasConfigFiles(node)) {
                    materializer.rewriteConfig(node);
                    log.info("Re-rendered configuration of node {}", node.getName());
                    report.getRepaired().add(node.getName());
                } else {
                    report.getVerified().add(node.getName());
                }
                return null;
            });
        }
        report.setTimestamp(Instant.now().toString());
        return report;
    }

    public int cancelSession(String sessionId) {
        return reconciler.cancelSession(sessionId);
    }

    private void requireValid(NodeConfig candidate, ValidationMode mode, String originalName) {
        ValidationResult result = timedValidation(candidate, mode, originalName);
        if (!result.isValid()) {
            log.warn("Rejected configuration for node {}: {}", candidate.getName(), result.getConflicts());
            throw new ConflictException(candidate.getName(), result);
        }
    }

    private ValidationResult timedValidation(NodeConfig candidate, ValidationMode mode, String originalName) {
        return withTimeout(() -> validator.validate(candidate, mode, originalName));
    }

    private <T> T withTimeout(Supplier<T> work) {
        Callable<T> task = work::get;
        Future<T> future = validationExecutor.submit(task);
        long timeout = properties.getValidation().getTimeout().toMillis();
        try {
            return future.get(timeout, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new NexusException(NexusErrorCode.VALIDATION_TIMEOUT,
                    "Validation did not finish within " + timeout + " ms");
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new NexusException(NexusErrorCode.INTERNAL_ERROR, "Validation failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NexusException(NexusErrorCode.INTERNAL_ERROR, "Validation interrupted", e);
        }
    }

    NodeConfig withDefaults(NodeConfigRequest request) {
        if (request == null) {
            throw invalid("Request body is required");
        }
        NexusProperties.Defaults defaults = properties.getDefaults();
        NodeConfig node = new NodeConfig();
        node.setName(requireName(request.getName()));
        node.setHost(blankToNull(request.getHost()) != null ? request.getHost().trim() : defaults.getHost());
        node.setHttpPort(request.getHttpPort() != null ? checkPort(request.getHttpPort()) : defaults.getHttpPort());
        node.setTransportPort(request.getTransportPort() != null
                ? checkPort(request.getTransportPort()) : defaults.getTransportPort());
        node.setCluster(blankToNull(request.getCluster()) != null
                ? request.getCluster().trim() : properties.getDefaultCluster());
        node.setRoles(request.getRoles() != null ? request.getRoles().copy() : NodeRoles.all());
        node.setHeapSize(blankToNull(request.getHeapSize()) != null ? request.getHeapSize().trim() : defaults.getHeapSize());
        NodeConfig laidOut = NodeMaterializer.withLayout(node, properties.getBasePath());
        if (blankToNull(request.getDataPath()) != null) {
            laidOut.setDataPath(request.getDataPath().trim());
        }
        if (blankToNull(request.getLogsPath()) != null) {
            laidOut.setLogsPath(request.getLogsPath().trim());
        }
        return laidOut;
    }

    NodeConfig merge(NodeConfig current, NodeConfigRequest request) {
        NodeConfig merged = current.copy();
        if (request.getName() != null) {
            merged.setName(requireName(request.getName()));
        }
        if (blankToNull(request.getHost()) != null) {
            merged.setHost(request.getHost().trim());
        }
        if (request.getHttpPort() != null) {
            merged.setHttpPort(checkPort(request.getHttpPort()));
        }
        if (request.getTransportPort() != null) {
            merged.setTransportPort(checkPort(request.getTransportPort()));
        }
        if (blankToNull(request.getCluster()) != null) {
            merged.setCluster(request.getCluster().trim());
        }
        if (blankToNull(request.getDataPath()) != null) {
            merged.setDataPath(request.getDataPath().trim());
        }
        if (blankToNull(request.getLogsPath()) != null) {
            merged.setLogsPath(request.getLogsPath().trim());
        }
        if (request.getRoles() != null) {
            merged.setRoles(request.getRoles().copy());
        }
        if (blankToNull(request.getHeapSize()) != null) {
            merged.setHeapSize(request.getHeapSize().trim());
        }
        return merged;
    }

    private void restoreConfig(NodeConfig previous) {
        try {
            materializer.rewriteConfig(previous);
        } catch (NexusException e) {
            log.error("Could not restore configuration files of node {}: {}", previous.getName(), e.getMessage());
        }
    }

    /**
     * Node names plus the directories a mutation writes into, so two nodes
     * pointed at the same directory are never materialized concurrently.
     */
    private static List<String> lockKeys(String name, String otherName, NodeConfig paths) {
        List<String> keys = new ArrayList<>();
        keys.add(name);
        keys.add(otherName);
        keys.add(pathKey(paths.getDataPath()));
        keys.add(pathKey(paths.getLogsPath()));
        keys.add(pathKey(paths.getConfigPath()));
        return keys;
    }

    private static String pathKey(String path) {
        return path == null ? null : "path:" + Paths.get(path).toAbsolutePath().normalize();
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw invalid("Node name is required");
        }
        String trimmed = name.trim();
        if (!NODE_NAME.matcher(trimmed).matches()) {
            throw invalid("Node name \"" + trimmed + "\" may only contain letters, digits, '.', '_' and '-'");
        }
        return trimmed;
    }

    private static int checkPort(int port) {
        if (port < 1 || port > NodeConfigValidator.MAX_PORT) {
            throw invalid("Port " + port + " is outside 1-" + NodeConfigValidator.MAX_PORT);
        }
        return port;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private static NexusException invalid(String message) {
        return new NexusException(NexusErrorCode.INVALID_INPUT, message);
    }
}
