package com.searchnexus.service;

import com.searchnexus.config.NexusProperties;
import com.searchnexus.model.NodeConfig;
import com.searchnexus.model.NodeRoles;
import com.searchnexus.model.ProbeResult;
import com.searchnexus.util.KeyedLocks;
import com.searchnexus.util.MemoryReporter;
import com.searchnexus.util.ProcessSupervisor;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.nio.file.Path;
import java.time.Duration;
import java.util.function.UnaryOperator;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Real services over a temporary directory. Only the process supervisor is
 * mocked; it reports every node as stopped unless a test says otherwise.
 */
class NexusTestContext implements AutoCloseable {

    static final long GIGABYTE = 1024L * 1024L * 1024L;

    final Path root;
    final NexusProperties properties = new NexusProperties();
    final ProcessSupervisor supervisor = mock(ProcessSupervisor.class);
    final MemoryReporter memory = () -> 64 * GIGABYTE;
    final ThreadPoolTaskExecutor validationExecutor = new ThreadPoolTaskExecutor();
    final KeyedLocks nodeLocks = new KeyedLocks();

    final NodeRegistry registry;
    final NodeConfigValidator validator;
    final NodeMaterializer materializer = new NodeMaterializer();
    final HealthMonitorService monitor;
    final LifecycleTaskService tasks;
    final LifecycleReconciler reconciler;
    final NodeOrchestrator orchestrator;
    final ClusterService clusters;

    NexusTestContext(Path root) {
        this(root, UnaryOperator.identity());
    }

    NexusTestContext(Path root, UnaryOperator<NodeRegistry> registryDecorator) {
        this.root = root;
        properties.setBasePath(root.resolve("base").toString());
        properties.setRegistryFile(root.resolve("configs/node-registry.json").toString());
        properties.getReconcile().setStartAttempts(3);
        properties.getReconcile().setStopAttempts(3);
        properties.getReconcile().setStartInterval(Duration.ZERO);
        properties.getReconcile().setStopInterval(Duration.ZERO);
        when(supervisor.healthProbe(any())).thenReturn(ProbeResult.stopped());

        validationExecutor.setCorePoolSize(1);
        validationExecutor.initialize();

        registry = registryDecorator.apply(new NodeRegistry(properties));
        validator = new NodeConfigValidator(registry, memory, properties);
        monitor = new HealthMonitorService(registry, supervisor);
        tasks = new LifecycleTaskService(properties);
        reconciler = new LifecycleReconciler(supervisor, monitor, tasks, new SyncTaskExecutor(), duration -> {
        }, properties);
        orchestrator = new NodeOrchestrator(registry, validator, materializer, reconciler, monitor, properties,
                validationExecutor, nodeLocks);
        clusters = new ClusterService(registry, materializer, reconciler, monitor, properties, nodeLocks);
    }

    void reportRunning(String nodeName) {
        when(supervisor.healthProbe(named(nodeName))).thenReturn(new ProbeResult(true, 4242L));
    }

    void reportStopped(String nodeName) {
        when(supervisor.healthProbe(named(nodeName))).thenReturn(ProbeResult.stopped());
    }

    private static NodeConfig named(String nodeName) {
        return argThat(node -> node != null && nodeName.equals(node.getName()));
    }

    static NodeConfig node(String name, int httpPort, int transportPort) {
        return new NodeConfig(name, "localhost", httpPort, transportPort, "search-cluster",
                "/srv/nodes/" + name + "/data", "/srv/nodes/" + name + "/logs", "/srv/nodes/" + name + "/config",
                NodeRoles.all(), "1g");
    }

    @Override
    public void close() {
        validationExecutor.shutdown();
    }
}
