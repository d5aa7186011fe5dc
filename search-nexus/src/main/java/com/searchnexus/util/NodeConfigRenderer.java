package com.searchnexus.util;

import com.searchnexus.model.NodeConfig;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders the engine's on-disk configuration files for a node.
 */
public final class NodeConfigRenderer {

    public static final String ENGINE_CONFIG_FILE = "elasticsearch.yml";
    public static final String JVM_OPTIONS_FILE = "jvm.options";
    public static final String PID_FILE = "node.pid";

    private NodeConfigRenderer() {
    }

    public static String renderEngineConfig(NodeConfig node) {
        List<String> lines = new ArrayList<>();
        lines.add("# Engine configuration for " + node.getName());
        lines.add("# Generated by search-nexus");
        lines.add("");
        lines.add("# Cluster settings");
        lines.add("cluster.name: " + node.getCluster());
        lines.add("node.name: " + node.getName());
        lines.add("");
        lines.add("# Network settings");
        lines.add("network.host: " + node.getHost());
        lines.add("http.port: " + node.getHttpPort());
        lines.add("transport.port: " + node.getTransportPort());
        lines.add("");
        lines.add("# Path settings");
        lines.add("path.data: " + node.getDataPath());
        lines.add("path.logs: " + node.getLogsPath());
        lines.add("");
        lines.add("# Node roles");
        lines.add("node.roles: [" + String.join(", ", node.getRoles().names()) + "]");
        lines.add("");
        lines.add("# Custom attribute for shard allocation");
        lines.add("node.attr.custom_id: " + node.getName());
        lines.add("");
        lines.add("discovery.type: single-node");
        lines.add("bootstrap.memory_lock: false");
        lines.add("");
        lines.add("xpack.security.enabled: false");
        lines.add("xpack.security.transport.ssl.enabled: false");
        lines.add("xpack.security.http.ssl.enabled: false");
        lines.add("");
        return String.join("\n", lines);
    }

    public static String renderJvmOptions(String heapSize) {
        return String.join("\n",
                "## JVM configuration",
                "# Generated by search-nexus",
                "",
                "-Xms" + heapSize,
                "-Xmx" + heapSize,
                "",
                "14-:-XX:+UseG1GC",
                "14-:-XX:G1ReservePercent=25",
                "14-:-XX:InitiatingHeapOccupancyPercent=75",
                "",
                "-XX:+HeapDumpOnOutOfMemoryError",
                "-XX:HeapDumpPath=data",
                "");
    }
}
