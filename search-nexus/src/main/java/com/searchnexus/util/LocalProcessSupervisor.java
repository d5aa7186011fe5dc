package com.searchnexus.util;

import com.searchnexus.config.NexusProperties;
import com.searchnexus.exception.ProcessControlException;
import com.searchnexus.model.NodeConfig;
import com.searchnexus.model.ProbeResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Spawns engine processes on the local host. A node counts as running while
 * its HTTP port accepts connections.
 */
@Slf4j
@Component
public class LocalProcessSupervisor implements ProcessSupervisor {

    private final Map<String, Process> runningProcesses = new ConcurrentHashMap<>();
    private final NexusProperties properties;

    public LocalProcessSupervisor(NexusProperties properties) {
        this.properties = properties;
    }

    @Override
    public void launch(NodeConfig node) {
        if (isPortOpen(node.getHost(), node.getHttpPort())) {
            throw new ProcessControlException("HTTP port " + node.getHttpPort() + " is already in use on "
                    + node.getHost() + "; refusing to launch node " + node.getName());
        }
        Path executable = resolveExecutable();
        if (!Files.isExecutable(executable)) {
            throw new ProcessControlException("Engine executable not found or not executable: " + executable);
        }

        Path configDir = Paths.get(node.getConfigPath());
        List<String> command = new ArrayList<>();
        command.add(executable.toString());
        command.add("-p");
        command.add(configDir.resolve(NodeConfigRenderer.PID_FILE).toString());

        ProcessBuilder processBuilder = new ProcessBuilder(command);
        processBuilder.environment().put("ES_PATH_CONF", configDir.toString());
        processBuilder.environment().put("ES_JAVA_OPTS", "-Xms" + node.getHeapSize() + " -Xmx" + node.getHeapSize());
        processBuilder.redirectErrorStream(true);
        try {
            Process process = processBuilder.start();
            runningProcesses.put(node.getName(), process);
            startOutputReader(node.getName(), process);
            log.info("Launched node {} (pid {}) with config {}", node.getName(), process.pid(), configDir);
        } catch (IOException e) {
            throw new ProcessControlException("Failed to launch node " + node.getName() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void terminate(NodeConfig node) {
        Process tracked = runningProcesses.remove(node.getName());
        if (tracked != null && tracked.isAlive()) {
            tracked.destroy();
            log.info("Sent termination to node {} (pid {})", node.getName(), tracked.pid());
            return;
        }
        Optional<ProcessHandle> handle = readPid(node).flatMap(ProcessHandle::of).filter(ProcessHandle::isAlive);
        if (handle.isEmpty()) {
            throw new ProcessControlException("Could not find a process for node " + node.getName());
        }
        if (!handle.get().destroy()) {
            throw new ProcessControlException("Termination of node " + node.getName() + " (pid "
                    + handle.get().pid() + ") was refused");
        }
        log.info("Sent termination to node {} (pid {} from pid file)", node.getName(), handle.get().pid());
    }

    @Override
    public ProbeResult healthProbe(NodeConfig node) {
        boolean running = isPortOpen(node.getHost(), node.getHttpPort());
        Long pid = null;
        Process tracked = runningProcesses.get(node.getName());
        if (tracked != null && tracked.isAlive()) {
            pid = tracked.pid();
        } else if (running) {
            pid = readPid(node).orElse(null);
        }
        return new ProbeResult(running, pid);
    }

    private boolean isPortOpen(String host, int port) {
        int timeout = (int) properties.getMonitor().getProbeTimeout().toMillis();
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(host, port), timeout);
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    private Optional<Long> readPid(NodeConfig node) {
        if (node.getConfigPath() == null) {
            return Optional.empty();
        }
        Path pidFile = Paths.get(node.getConfigPath(), NodeConfigRenderer.PID_FILE);
        if (!Files.isRegularFile(pidFile)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(Files.readString(pidFile).trim()));
        } catch (IOException | NumberFormatException e) {
            log.warn("Unreadable pid file {}: {}", pidFile, e.getMessage());
            return Optional.empty();
        }
    }

    private Path resolveExecutable() {
        NexusProperties.Engine engine = properties.getEngine();
        if (engine.getExecutable() != null && !engine.getExecutable().isBlank()) {
            return Paths.get(engine.getExecutable());
        }
        if (engine.getHome() == null || engine.getHome().isBlank()) {
            throw new ProcessControlException("nexus.engine.home is not configured");
        }
        boolean windows = System.getProperty("os.name").toLowerCase().contains("win");
        return Paths.get(engine.getHome(), "bin", windows ? "elasticsearch.bat" : "elasticsearch");
    }

    static BufferedReader outputReader(InputStream output) {
        return new BufferedReader(new InputStreamReader(output, StandardCharsets.UTF_8));
    }

    private static void startOutputReader(String nodeName, Process process) {
        Thread outputThread = new Thread(() -> {
            try (BufferedReader reader = outputReader(process.getInputStream())) {
                String line;
                while ((line = reader.readLine()) != null) {
                    log.debug("[{}] {}", nodeName, line);
                }
            } catch (IOException e) {
                log.debug("Output of node {} closed: {}", nodeName, e.getMessage());
            }
        });
        outputThread.setDaemon(true);
        outputThread.setName("OutputReader-" + nodeName);
        outputThread.start();
    }
}
