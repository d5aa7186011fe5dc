package com.searchnexus.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.searchnexus.config.NexusProperties;
import com.searchnexus.exception.ConflictException;
import com.searchnexus.exception.FilesystemException;
import com.searchnexus.exception.NodeNotFoundException;
import com.searchnexus.model.NodeConfig;
import com.searchnexus.model.ValidationResult;
import com.searchnexus.util.FileTreeUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Durable name to configuration map, persisted as one JSON document.
 * Readers always get copies taken under the read lock, so a scan never sees a
 * half-applied write. Clusters are derived from the records.
 */
@Slf4j
@Service
public class NodeRegistry {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Map<String, NodeConfig> nodes = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Path registryFile;

    public NodeRegistry(NexusProperties properties) {
        this.registryFile = Paths.get(properties.getRegistryFile());
        load();
    }

    private void load() {
        if (!Files.isRegularFile(registryFile)) {
            log.info("No node registry at {}, starting empty", registryFile.toAbsolutePath());
            return;
        }
        try {
            List<NodeConfig> stored = objectMapper.readValue(registryFile.toFile(), new TypeReference<List<NodeConfig>>() {
            });
            stored.forEach(node -> nodes.put(node.getName(), node));
            log.info("Loaded {} node(s) from {}", nodes.size(), registryFile.toAbsolutePath());
        } catch (IOException e) {
            throw new FilesystemException("Failed to read node registry " + registryFile + ": " + e.getMessage(), e);
        }
    }

    public List<NodeConfig> snapshot() {
        lock.readLock().lock();
        try {
            return nodes.values().stream().map(NodeConfig::copy).collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<NodeConfig> find(String name) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(nodes.get(name)).map(NodeConfig::copy);
        } finally {
            lock.readLock().unlock();
        }
    }

    public NodeConfig get(String name) {
        return find(name).orElseThrow(() -> new NodeNotFoundException(name));
    }

    public Set<String> clusterNames() {
        return snapshot().stream().map(NodeConfig::getCluster).collect(Collectors.toCollection(TreeSet::new));
    }

    public List<NodeConfig> members(String cluster) {
        return snapshot().stream().filter(node -> cluster.equals(node.getCluster())).collect(Collectors.toList());
    }

    /**
     * Stores {@code node}, replacing {@code originalName} when it differs. The
     * {@code recheck} runs against the live records under the write lock and
     * aborts the commit when it reports conflicts.
     */
    public NodeConfig commit(NodeConfig node, String originalName,
                             Function<Collection<NodeConfig>, ValidationResult> recheck) {
        lock.writeLock().lock();
        try {
            if (recheck != null) {
                ValidationResult result = recheck.apply(List.copyOf(nodes.values()));
                if (!result.isValid()) {
                    throw new ConflictException(node.getName(), result);
                }
            }
            Map<String, NodeConfig> before = new LinkedHashMap<>(nodes);
            if (originalName != null && !originalName.equals(node.getName())) {
                nodes.remove(originalName);
            }
            nodes.put(node.getName(), node.copy());
            persistOrRevert(before);
            return node.copy();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void commitAll(Collection<NodeConfig> updated) {
        lock.writeLock().lock();
        try {
            Map<String, NodeConfig> before = new LinkedHashMap<>(nodes);
            for (NodeConfig node : updated) {
                if (!nodes.containsKey(node.getName())) {
                    throw new NodeNotFoundException(node.getName());
                }
                nodes.put(node.getName(), node.copy());
            }
            persistOrRevert(before);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public NodeConfig remove(String name) {
        lock.writeLock().lock();
        try {
            Map<String, NodeConfig> before = new LinkedHashMap<>(nodes);
            NodeConfig removed = nodes.remove(name);
            if (removed == null) {
                throw new NodeNotFoundException(name);
            }
            persistOrRevert(before);
            return removed.copy();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void persistOrRevert(Map<String, NodeConfig> before) {
        try {
            persist();
        } catch (IOException e) {
            nodes.clear();
            nodes.putAll(before);
            log.error("Failed to save node registry {}: {}", registryFile, e.getMessage());
            throw new FilesystemException("Failed to save node registry: " + e.getMessage(), e);
        }
    }

    void persist() throws IOException {
        String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(new ArrayList<>(nodes.values()));
        Path parent = registryFile.toAbsolutePath().getParent();
        FileTreeUtils.writeAtomically(parent.resolve(registryFile.getFileName()), json);
    }
}
