package com.searchnexus.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.time.Instant;

@Data
public class NodeStatus {
    private String name;
    private String cluster;
    private String host;
    private int httpPort;
    private int transportPort;
    private String dataPath;
    private String logsPath;
    private String configPath;
    private NodeRoles roles;
    private String heapSize;
    private String nodeUrl;
    private LifecycleState state;
    @JsonProperty("isRunning")
    private boolean running;
    private Long pid;
    private String lastChecked;

    public static NodeStatus of(NodeConfig config, NodeHealth health) {
        NodeStatus status = new NodeStatus();
        status.setName(config.getName());
        status.setCluster(config.getCluster());
        status.setHost(config.getHost());
        status.setHttpPort(config.getHttpPort());
        status.setTransportPort(config.getTransportPort());
        status.setDataPath(config.getDataPath());
        status.setLogsPath(config.getLogsPath());
        status.setConfigPath(config.getConfigPath());
        status.setRoles(config.getRoles());
        status.setHeapSize(config.getHeapSize());
        status.setNodeUrl(config.nodeUrl());
        status.setState(health.getState());
        status.setRunning(health.isRunning());
        status.setPid(health.getPid());
        if (health.getLastCheckTime() > 0) {
            status.setLastChecked(Instant.ofEpochMilli(health.getLastCheckTime()).toString());
        }
        return status;
    }
}
