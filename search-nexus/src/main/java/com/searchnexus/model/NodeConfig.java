package com.searchnexus.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Durable configuration record of one node. Observed process state is kept
 * apart, in {@link NodeStatus}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class NodeConfig {
    private String name;
    private String host;
    private int httpPort;
    private int transportPort;
    private String cluster;
    private String dataPath;
    private String logsPath;
    private String configPath; // directory holding elasticsearch.yml and jvm.options
    private NodeRoles roles = NodeRoles.all();
    private String heapSize;

    public NodeConfig copy() {
        return new NodeConfig(name, host, httpPort, transportPort, cluster, dataPath, logsPath, configPath,
                roles != null ? roles.copy() : null, heapSize);
    }

    public String nodeUrl() {
        return "http://" + host + ":" + httpPort;
    }
}
