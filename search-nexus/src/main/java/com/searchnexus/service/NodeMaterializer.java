package com.searchnexus.service;

import com.searchnexus.exception.FilesystemException;
import com.searchnexus.exception.NexusErrorCode;
import com.searchnexus.model.NodeConfig;
import com.searchnexus.util.FileTreeUtils;
import com.searchnexus.util.NodeConfigRenderer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Owns the on-disk footprint of a node: {@code <base>/nodes/<name>/{config,data,logs}}.
 * Does not check uniqueness, only that target directories are usable. Every
 * multi-step operation removes what it created before rethrowing.
 */
@Slf4j
@Service
public class NodeMaterializer {

    public static NodeConfig withLayout(NodeConfig node, String basePath) {
        Path root = nodeRoot(basePath, node.getName());
        NodeConfig laidOut = node.copy();
        laidOut.setDataPath(root.resolve("data").toString());
        laidOut.setLogsPath(root.resolve("logs").toString());
        laidOut.setConfigPath(root.resolve("config").toString());
        return laidOut;
    }

    public static Path nodeRoot(String basePath, String nodeName) {
        return Paths.get(basePath).toAbsolutePath().normalize().resolve("nodes").resolve(nodeName);
    }

    public NodeFootprint materialize(NodeConfig node) {
        requireUsable(node);
        NodeFootprint footprint = new NodeFootprint();
        try {
            createDirectories(node, footprint);
            writeConfigFiles(node);
            log.info("Materialized node {} under {}", node.getName(), node.getConfigPath());
            return footprint;
        } catch (IOException e) {
            rollback(footprint);
            throw new FilesystemException("Failed to create files for node " + node.getName() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Re-renders configuration and creates any directory the update introduced.
     * The returned footprint covers only those new directories; the caller
     * restores the previous configuration itself.
     */
    public NodeFootprint applyUpdate(NodeConfig current, NodeConfig updated) {
        NodeFootprint footprint = new NodeFootprint();
        try {
            if (!samePath(current.getDataPath(), updated.getDataPath())) {
                requireEmpty(Paths.get(updated.getDataPath()));
            }
            if (!samePath(current.getLogsPath(), updated.getLogsPath())) {
                requireEmpty(Paths.get(updated.getLogsPath()));
            }
            List<String> introduced = new ArrayList<>();
            for (String dir : List.of(updated.getDataPath(), updated.getLogsPath())) {
                if (!samePath(dir, current.getDataPath()) && !samePath(dir, current.getLogsPath())) {
                    introduced.add(dir);
                }
            }
            createDirectories(introduced, footprint);
            Files.createDirectories(Paths.get(updated.getConfigPath()));
            writeConfigFiles(updated);
            return footprint;
        } catch (IOException e) {
            rollback(footprint);
            throw new FilesystemException("Failed to update files for node " + updated.getName() + ": " + e.getMessage(), e);
        }
    }

    public void writeConfigFiles(NodeConfig node) throws IOException {
        Path configDir = Paths.get(node.getConfigPath());
        FileTreeUtils.writeAtomically(configDir.resolve(NodeConfigRenderer.ENGINE_CONFIG_FILE),
                NodeConfigRenderer.renderEngineConfig(node));
        FileTreeUtils.writeAtomically(configDir.resolve(NodeConfigRenderer.JVM_OPTIONS_FILE),
                NodeConfigRenderer.renderJvmOptions(node.getHeapSize()));
    }

    public void rewriteConfig(NodeConfig node) {
        try {
            writeConfigFiles(node);
        } catch (IOException e) {
            throw new FilesystemException("Failed to write configuration of node " + node.getName() + ": "
                    + e.getMessage(), e);
        }
    }

    /**
     * Builds the tree at {@code target}'s paths. With {@code preserveData} the
     * data, logs and config directories are copied over; otherwise the new
     * tree starts empty. The source tree is never modified here.
     */
    public NodeFootprint relocate(NodeConfig source, NodeConfig target, boolean preserveData) {
        requireUsable(target);
        NodeFootprint footprint = new NodeFootprint();
        try {
            createDirectories(target, footprint);
            if (preserveData) {
                FileTreeUtils.copyTree(Paths.get(source.getDataPath()), Paths.get(target.getDataPath()));
                FileTreeUtils.copyTree(Paths.get(source.getLogsPath()), Paths.get(target.getLogsPath()));
                FileTreeUtils.copyTree(Paths.get(source.getConfigPath()), Paths.get(target.getConfigPath()),
                        path -> !isRuntimeFile(path));
            }
            writeConfigFiles(target);
            log.info("Relocated node {} to {} (preserveData={})", source.getName(), target.getConfigPath(), preserveData);
            return footprint;
        } catch (IOException e) {
            rollback(footprint);
            throw new FilesystemException("Failed to move node " + source.getName() + ": " + e.getMessage(), e);
        }
    }

    public NodeFootprint duplicate(NodeConfig source, NodeConfig target, boolean copyData) {
        requireUsable(target);
        NodeFootprint footprint = new NodeFootprint();
        try {
            createDirectories(target, footprint);
            if (copyData) {
                FileTreeUtils.copyTree(Paths.get(source.getDataPath()), Paths.get(target.getDataPath()),
                        path -> !isRuntimeFile(path));
                FileTreeUtils.copyTree(Paths.get(source.getLogsPath()), Paths.get(target.getLogsPath()));
            }
            writeConfigFiles(target);
            log.info("Copied node {} to {} (copyData={})", source.getName(), target.getName(), copyData);
            return footprint;
        } catch (IOException e) {
            rollback(footprint);
            throw new FilesystemException("Failed to copy node " + source.getName() + " to " + target.getName()
                    + ": " + e.getMessage(), e);
        }
    }

    /**
     * Undoes one materializer call. Directories it created are deleted along
     * with any ancestors it created that are empty again; existing directories
     * it wrote into are emptied but kept. Failures are logged, not thrown.
     */
    public void rollback(NodeFootprint footprint) {
        for (Path dir : footprint.reused()) {
            try {
                FileTreeUtils.clearDirectory(dir);
            } catch (IOException e) {
                log.warn("Rollback could not empty {}: {}", dir, e.getMessage());
            }
        }
        List<NodeFootprint.CreatedDirectory> created = new ArrayList<>(footprint.created());
        Collections.reverse(created);
        for (NodeFootprint.CreatedDirectory entry : created) {
            try {
                FileTreeUtils.deleteTree(entry.getDirectory());
                Path parent = entry.getDirectory().getParent();
                while (parent != null && parent.startsWith(entry.getTopmost()) && Files.isDirectory(parent)
                        && FileTreeUtils.isMissingOrEmpty(parent)) {
                    Files.delete(parent);
                    parent = parent.getParent();
                }
            } catch (IOException e) {
                log.warn("Rollback could not remove {}: {}", entry.getDirectory(), e.getMessage());
            }
        }
    }

    /**
     * Best-effort removal of a node's files. Returns one warning per path that
     * could not be removed.
     */
    public List<String> removeNodeFiles(NodeConfig node, boolean preserveData) {
        List<String> warnings = new ArrayList<>();
        List<String> targets = new ArrayList<>();
        targets.add(node.getConfigPath());
        if (!preserveData) {
            targets.add(node.getDataPath());
            targets.add(node.getLogsPath());
        }
        for (String target : targets) {
            if (target == null) {
                continue;
            }
            try {
                FileTreeUtils.deleteTree(Paths.get(target));
            } catch (IOException e) {
                log.warn("Could not remove {} of node {}: {}", target, node.getName(), e.getMessage());
                warnings.add("Could not remove " + target + ": " + e.getMessage());
            }
        }
        removeParentIfEmpty(node);
        return warnings;
    }

    public String readConfigFile(NodeConfig node) {
        Path file = Paths.get(node.getConfigPath(), NodeConfigRenderer.ENGINE_CONFIG_FILE);
        try {
            return Files.readString(file);
        } catch (IOException e) {
            throw new FilesystemException("Failed to read " + file + ": " + e.getMessage(), e);
        }
    }

    public boolean hasConfigFiles(NodeConfig node) {
        Path configDir = Paths.get(node.getConfigPath());
        return Files.isRegularFile(configDir.resolve(NodeConfigRenderer.ENGINE_CONFIG_FILE))
                && Files.isRegularFile(configDir.resolve(NodeConfigRenderer.JVM_OPTIONS_FILE));
    }

    public boolean hasStorageDirectories(NodeConfig node) {
        return Files.isDirectory(Paths.get(node.getDataPath())) && Files.isDirectory(Paths.get(node.getLogsPath()));
    }

    private void requireUsable(NodeConfig node) {
        try {
            requireEmpty(Paths.get(node.getDataPath()));
            requireEmpty(Paths.get(node.getLogsPath()));
            requireEmpty(Paths.get(node.getConfigPath()));
        } catch (IOException e) {
            throw new FilesystemException("Cannot inspect target directories of node " + node.getName() + ": "
                    + e.getMessage(), e);
        }
    }

    private static void requireEmpty(Path dir) throws IOException {
        if (!FileTreeUtils.isMissingOrEmpty(dir)) {
            throw new FilesystemException(NexusErrorCode.DESTINATION_EXISTS,
                    "Destination " + dir + " already exists and is not empty");
        }
    }

    private static void createDirectories(NodeConfig node, NodeFootprint footprint) throws IOException {
        createDirectories(List.of(node.getDataPath(), node.getLogsPath(), node.getConfigPath()), footprint);
    }

    private static void createDirectories(List<String> dirs, NodeFootprint footprint) throws IOException {
        for (String dir : dirs) {
            Path path = Paths.get(dir).toAbsolutePath().normalize();
            if (footprint.covers(path)) {
                continue;
            }
            if (Files.exists(path)) {
                if (FileTreeUtils.isMissingOrEmpty(path)) {
                    footprint.recordReused(path);
                }
                continue;
            }
            Path topmost = NodeFootprint.topmostMissing(path);
            Files.createDirectories(path);
            footprint.recordCreated(path, topmost);
        }
    }

    private static void removeParentIfEmpty(NodeConfig node) {
        if (node.getConfigPath() == null) {
            return;
        }
        Path root = Paths.get(node.getConfigPath()).getParent();
        try {
            if (root != null && Files.isDirectory(root) && FileTreeUtils.isMissingOrEmpty(root)) {
                Files.delete(root);
            }
        } catch (IOException e) {
            log.debug("Left node directory {} in place: {}", root, e.getMessage());
        }
    }

    private static boolean isRuntimeFile(Path path) {
        String name = path.getFileName().toString();
        return name.endsWith(".lock") || name.equals(NodeConfigRenderer.PID_FILE);
    }

    private static boolean samePath(String a, String b) {
        return a != null && b != null && Paths.get(a).toAbsolutePath().normalize()
                .equals(Paths.get(b).toAbsolutePath().normalize());
    }
}
