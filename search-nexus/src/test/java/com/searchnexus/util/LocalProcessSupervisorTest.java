package com.searchnexus.util;

import com.searchnexus.config.NexusProperties;
import com.searchnexus.exception.ProcessControlException;
import com.searchnexus.model.NodeConfig;
import com.searchnexus.model.NodeRoles;
import com.searchnexus.model.ProbeResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocalProcessSupervisorTest {

    @TempDir
    Path tempDir;

    private NodeConfig node(int httpPort) {
        Path root = tempDir.resolve("nodes/node-1");
        return new NodeConfig("node-1", "127.0.0.1", httpPort, httpPort + 100, "search-cluster",
                root.resolve("data").toString(), root.resolve("logs").toString(), root.resolve("config").toString(),
                NodeRoles.all(), "1g");
    }

    @Test
    void engineOutputIsDecodedAsUtf8() throws IOException {
        byte[] output = "[2024-01-01] Knoten gestartet: Überprüfung abgeschlossen\n".getBytes(StandardCharsets.UTF_8);

        try (BufferedReader reader = LocalProcessSupervisor.outputReader(new ByteArrayInputStream(output))) {
            assertThat(reader.readLine()).isEqualTo("[2024-01-01] Knoten gestartet: Überprüfung abgeschlossen");
        }
    }

    @Test
    void probeReportsOpenPortAsRunning() throws IOException {
        LocalProcessSupervisor supervisor = new LocalProcessSupervisor(new NexusProperties());
        try (ServerSocket listener = new ServerSocket(0)) {
            ProbeResult probe = supervisor.healthProbe(node(listener.getLocalPort()));

            assertThat(probe.isRunning()).isTrue();
            assertThat(probe.getPid()).isNull();
        }
    }

    @Test
    void launchRefusesOccupiedHttpPort() throws IOException {
        LocalProcessSupervisor supervisor = new LocalProcessSupervisor(new NexusProperties());
        try (ServerSocket listener = new ServerSocket(0)) {
            assertThatThrownBy(() -> supervisor.launch(node(listener.getLocalPort())))
                    .isInstanceOf(ProcessControlException.class)
                    .hasMessageContaining("already in use");
        }
    }

    @Test
    void terminateWithoutProcessFails() {
        LocalProcessSupervisor supervisor = new LocalProcessSupervisor(new NexusProperties());

        assertThatThrownBy(() -> supervisor.terminate(node(1)))
                .isInstanceOf(ProcessControlException.class);
    }
}
