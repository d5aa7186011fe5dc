package com.searchnexus.service;

import com.searchnexus.config.NexusProperties;
import com.searchnexus.exception.ClusterNotFoundException;
import com.searchnexus.exception.NexusErrorCode;
import com.searchnexus.exception.NexusException;
import com.searchnexus.model.ClusterStatus;
import com.searchnexus.model.NodeConfig;
import com.searchnexus.model.NodeStatus;
import com.searchnexus.util.KeyedLocks;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Clusters only exist through their members' {@code cluster} field, so every
 * cluster operation is a batch update of member nodes.
 */
@Slf4j
@Service
public class ClusterService {

    private final NodeRegistry registry;
    private final NodeMaterializer materializer;
    private final LifecycleReconciler reconciler;
    private final HealthMonitorService monitor;
    private final NexusProperties properties;
    private final KeyedLocks nodeLocks;

    public ClusterService(NodeRegistry registry, NodeMaterializer materializer, LifecycleReconciler reconciler,
                          HealthMonitorService monitor, NexusProperties properties, KeyedLocks nodeLocks) {
        this.registry = registry;
        this.materializer = materializer;
        this.reconciler = reconciler;
        this.monitor = monitor;
        this.properties = properties;
        this.nodeLocks = nodeLocks;
    }

    public List<ClusterStatus> listClusters() {
        Map<String, List<NodeConfig>> byCluster = registry.snapshot().stream()
                .collect(Collectors.groupingBy(NodeConfig::getCluster));
        Set<String> names = new TreeSet<>(byCluster.keySet());
        names.add(properties.getDefaultCluster());
        return names.stream()
                .map(name -> ClusterStatus.of(name, statuses(byCluster.getOrDefault(name, List.of()))))
                .collect(Collectors.toList());
    }

    public ClusterStatus getCluster(String name) {
        List<NodeConfig> members = registry.members(name);
        if (members.isEmpty() && !name.equals(properties.getDefaultCluster())) {
            throw new ClusterNotFoundException(name);
        }
        return ClusterStatus.of(name, statuses(members));
    }

    public ClusterStatus renameCluster(String name, String newName) {
        if (newName == null || newName.isBlank()) {
            throw new NexusException(NexusErrorCode.INVALID_INPUT, "newName is required");
        }
        String target = newName.trim();
        if (target.equals(name)) {
            return getCluster(name);
        }
        List<String> moved = reassign(name, target);
        log.info("Renamed cluster {} to {} ({} node(s))", name, target, moved.size());
        return getCluster(target);
    }

    public Map<String, Object> deleteCluster(String name, String targetCluster) {
        if (name.equals(properties.getDefaultCluster())) {
            throw new NexusException(NexusErrorCode.DEFAULT_CLUSTER,
                    "The default cluster \"" + name + "\" cannot be deleted").with("cluster", name);
        }
        if (registry.members(name).isEmpty()) {
            throw new ClusterNotFoundException(name);
        }
        if (targetCluster == null || targetCluster.isBlank()) {
            throw new NexusException(NexusErrorCode.CLUSTER_NOT_EMPTY,
                    "Cluster \"" + name + "\" still has nodes; choose a target cluster for them").with("cluster", name);
        }
        String target = targetCluster.trim();
        if (target.equals(name)) {
            throw new NexusException(NexusErrorCode.INVALID_INPUT, "Target cluster must differ from \"" + name + "\"");
        }
        List<String> moved = reassign(name, target);
        log.info("Deleted cluster {}; moved {} node(s) to {}", name, moved.size(), target);
        return Map.of(
                "cluster", name,
                "targetCluster", target,
                "movedNodes", moved
        );
    }

    /**
     * Locks the members seen before locking; if membership changed meanwhile
     * the locks are dropped and the member set is read again.
     */
    private List<String> reassign(String from, String to) {
        while (true) {
            Set<String> memberNames = names(registry.members(from));
            if (memberNames.isEmpty()) {
                throw new ClusterNotFoundException(from);
            }
            List<String> moved = reassignLocked(from, to, memberNames);
            if (moved != null) {
                return moved;
            }
        }
    }

    private List<String> reassignLocked(String from, String to, Set<String> memberNames) {
        return nodeLocks.withLocks(memberNames, () -> {
            List<NodeConfig> members = registry.members(from);
            if (!names(members).equals(memberNames)) {
                log.debug("Members of cluster {} changed while locking; retrying", from);
                return null;
            }
            members.forEach(reconciler::assertQuiescent);
            List<NodeConfig> updated = new ArrayList<>();
            for (NodeConfig member : members) {
                NodeConfig copy = member.copy();
                copy.setCluster(to);
                updated.add(copy);
            }
            List<NodeConfig> rewritten = new ArrayList<>();
            try {
                for (NodeConfig node : updated) {
                    materializer.rewriteConfig(node);
                    rewritten.add(node);
                }
                registry.commitAll(updated);
            } catch (RuntimeException e) {
                Map<String, NodeConfig> originals = members.stream()
                        .collect(Collectors.toMap(NodeConfig::getName, node -> node));
                for (NodeConfig node : rewritten) {
                    restore(originals.get(node.getName()));
                }
                throw e;
            }
            return updated.stream().map(NodeConfig::getName).collect(Collectors.toList());
        });
    }

    private static Set<String> names(List<NodeConfig> nodes) {
        return nodes.stream().map(NodeConfig::getName).collect(Collectors.toCollection(TreeSet::new));
    }

    private void restore(NodeConfig original) {
        try {
            materializer.rewriteConfig(original);
        } catch (NexusException e) {
            log.error("Could not restore configuration files of node {}: {}", original.getName(), e.getMessage());
        }
    }

    private List<NodeStatus> statuses(List<NodeConfig> members) {
        return members.stream()
                .map(node -> NodeStatus.of(node, monitor.get(node.getName())))
                .collect(Collectors.toList());
    }
}
