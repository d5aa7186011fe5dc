package com.searchnexus.service;

import com.searchnexus.config.NexusProperties;
import com.searchnexus.exception.ResourceExhaustionException;
import com.searchnexus.model.Conflict;
import com.searchnexus.model.ConflictType;
import com.searchnexus.model.NodeConfig;
import com.searchnexus.model.Suggestions;
import com.searchnexus.model.ValidationMode;
import com.searchnexus.model.ValidationResult;
import com.searchnexus.util.HeapSize;
import com.searchnexus.util.MemoryReporter;
import org.springframework.stereotype.Service;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Checks a candidate configuration against the other registered nodes and
 * computes replacement values for whatever collides. Conflicts are returned
 * as data; the only exception raised is {@link ResourceExhaustionException}
 * when no free value exists inside the search window.
 */
@Service
public class NodeConfigValidator {

    static final int MAX_PORT = 65535;

    private final NodeRegistry registry;
    private final MemoryReporter memoryReporter;
    private final NexusProperties properties;

    public NodeConfigValidator(NodeRegistry registry, MemoryReporter memoryReporter, NexusProperties properties) {
        this.registry = registry;
        this.memoryReporter = memoryReporter;
        this.properties = properties;
    }

    public ValidationResult validate(NodeConfig candidate, ValidationMode mode, String originalName) {
        return validate(candidate, mode, originalName, registry.snapshot());
    }

    public ValidationResult validate(NodeConfig candidate, ValidationMode mode, String originalName,
                                     Collection<NodeConfig> registered) {
        List<NodeConfig> others = comparisonSet(candidate, mode, originalName, registered);
        List<Conflict> conflicts = new ArrayList<>(detectConflicts(candidate, others));
        List<String> warnings = new ArrayList<>();

        checkHeap(candidate.getHeapSize()).ifPresent(conflicts::add);
        checkRoles(candidate, warnings).ifPresent(conflicts::add);

        Suggestions suggestions = new Suggestions();
        if (conflicts.stream().anyMatch(c -> c.getType().isPort())) {
            int[] ports = suggestFreePorts(candidate.getHttpPort(), candidate.getTransportPort(), others);
            suggestions.setHttpPort(ports[0]);
            suggestions.setTransportPort(ports[1]);
        }
        if (conflicts.stream().anyMatch(c -> c.getType() == ConflictType.NODE_NAME)) {
            suggestions.setNodeName(suggestNames(candidate.getName(), others));
        }
        return ValidationResult.of(conflicts, suggestions, warnings);
    }

    /** Uniqueness conflicts only: name, both ports across both port fields, data and logs paths. */
    public List<Conflict> detectConflicts(NodeConfig candidate, Collection<NodeConfig> others) {
        List<Conflict> conflicts = new ArrayList<>();
        for (NodeConfig other : others) {
            if (Objects.equals(other.getName(), candidate.getName())) {
                conflicts.add(new Conflict(ConflictType.NODE_NAME,
                        "Node name \"" + candidate.getName() + "\" is already in use", other.getName()));
            }
            if (usesPort(other, candidate.getHttpPort())) {
                conflicts.add(new Conflict(ConflictType.HTTP_PORT,
                        "HTTP port " + candidate.getHttpPort() + " is already used by node \"" + other.getName() + "\"",
                        other.getName()));
            }
            if (usesPort(other, candidate.getTransportPort())) {
                conflicts.add(new Conflict(ConflictType.TRANSPORT_PORT,
                        "Transport port " + candidate.getTransportPort() + " is already used by node \""
                                + other.getName() + "\"", other.getName()));
            }
            if (samePath(other.getDataPath(), candidate.getDataPath())) {
                conflicts.add(new Conflict(ConflictType.DATA_PATH,
                        "Data path " + candidate.getDataPath() + " is already used by node \"" + other.getName() + "\"",
                        other.getName()));
            }
            if (samePath(other.getLogsPath(), candidate.getLogsPath())) {
                conflicts.add(new Conflict(ConflictType.LOGS_PATH,
                        "Logs path " + candidate.getLogsPath() + " is already used by node \"" + other.getName() + "\"",
                        other.getName()));
            }
        }
        if (candidate.getHttpPort() == candidate.getTransportPort()) {
            conflicts.add(new Conflict(ConflictType.TRANSPORT_PORT,
                    "Transport port must differ from HTTP port " + candidate.getHttpPort(), null));
        }
        return conflicts;
    }

    /**
     * First free HTTP and transport ports at or above the requested ones
     * (or the configured defaults when unset). The two results never collide.
     */
    public int[] suggestFreePorts(int requestedHttp, int requestedTransport, Collection<NodeConfig> others) {
        return suggestFreePorts(requestedHttp, requestedTransport, others, Set.of());
    }

    /** As above, with {@code reserved} ports treated as taken although no registered node holds them yet. */
    public int[] suggestFreePorts(int requestedHttp, int requestedTransport, Collection<NodeConfig> others,
                                  Collection<Integer> reserved) {
        Set<Integer> taken = new HashSet<>(reserved);
        for (NodeConfig other : others) {
            taken.add(other.getHttpPort());
            taken.add(other.getTransportPort());
        }
        int httpStart = requestedHttp > 0 ? requestedHttp : properties.getDefaults().getHttpPort();
        int transportStart = requestedTransport > 0 ? requestedTransport : properties.getDefaults().getTransportPort();

        Set<Integer> forHttp = new HashSet<>(taken);
        if (requestedTransport > 0 && requestedTransport != requestedHttp && !taken.contains(requestedTransport)) {
            forHttp.add(requestedTransport);
        }
        int http = firstFree(httpStart, forHttp, "HTTP");

        Set<Integer> forTransport = new HashSet<>(taken);
        forTransport.add(http);
        int transport = firstFree(transportStart, forTransport, "transport");
        return new int[]{http, transport};
    }

    private int firstFree(int start, Set<Integer> taken, String kind) {
        int window = properties.getValidation().getPortSearchWindow();
        for (int port = start; port <= Math.min(MAX_PORT, start + window); port++) {
            if (!taken.contains(port)) {
                return port;
            }
        }
        throw new ResourceExhaustionException("No free " + kind + " port within " + window + " of " + start);
    }

    List<String> suggestNames(String baseName, Collection<NodeConfig> others) {
        Set<String> used = others.stream().map(NodeConfig::getName).collect(Collectors.toSet());
        int wanted = properties.getValidation().getNameSuggestions();
        int window = properties.getValidation().getPortSearchWindow();
        List<String> names = new ArrayList<>();
        for (int i = 2; i <= window + 1 && names.size() < wanted; i++) {
            String candidate = baseName + "-" + i;
            if (!used.contains(candidate)) {
                names.add(candidate);
            }
        }
        if (names.isEmpty()) {
            throw new ResourceExhaustionException("No free node name derived from \"" + baseName + "\"");
        }
        return names;
    }

    private Optional<Conflict> checkHeap(String heapSize) {
        Optional<HeapSize> parsed = HeapSize.parse(heapSize);
        if (parsed.isEmpty()) {
            return Optional.of(new Conflict(ConflictType.HEAP_SIZE,
                    "Invalid heap size \"" + heapSize + "\". Use a number followed by k, m, g or t (e.g. 1g, 512m)",
                    null));
        }
        double totalGb = HeapSize.bytesToGigabytes(memoryReporter.totalMemoryBytes());
        double limitGb = totalGb * properties.getValidation().getHeapMaxFraction();
        if (parsed.get().toGigabytes() > limitGb) {
            return Optional.of(new Conflict(ConflictType.HEAP_SIZE,
                    String.format("Heap size %s exceeds %.0f%% of system memory (%.1f GB of %.1f GB)",
                            parsed.get(), properties.getValidation().getHeapMaxFraction() * 100, limitGb, totalGb),
                    null));
        }
        return Optional.empty();
    }

    private Optional<Conflict> checkRoles(NodeConfig candidate, List<String> warnings) {
        if (candidate.getRoles() != null && candidate.getRoles().anyEnabled()) {
            return Optional.empty();
        }
        String message = "Node \"" + candidate.getName() + "\" has no roles enabled";
        switch (properties.getValidation().getEmptyRolesPolicy()) {
            case REJECT:
                return Optional.of(new Conflict(ConflictType.NODE_ROLES, message, null));
            case WARN:
                warnings.add(message);
                return Optional.empty();
            default:
                return Optional.empty();
        }
    }

    private static List<NodeConfig> comparisonSet(NodeConfig candidate, ValidationMode mode, String originalName,
                                                  Collection<NodeConfig> registered) {
        String self = mode == ValidationMode.UPDATE
                ? (originalName != null ? originalName : candidate.getName())
                : null;
        return registered.stream()
                .filter(node -> self == null || !self.equals(node.getName()))
                .collect(Collectors.toList());
    }

    private static boolean usesPort(NodeConfig node, int port) {
        return port > 0 && (node.getHttpPort() == port || node.getTransportPort() == port);
    }

    private static boolean samePath(String a, String b) {
        if (a == null || b == null) {
            return false;
        }
        return Paths.get(a).toAbsolutePath().normalize().equals(Paths.get(b).toAbsolutePath().normalize());
    }
}
