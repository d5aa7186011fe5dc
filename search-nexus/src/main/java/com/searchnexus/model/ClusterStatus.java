package com.searchnexus.model;

import lombok.Data;

import java.util.List;

@Data
public class ClusterStatus {
    private String name;
    private int totalNodes;
    private int runningNodes;
    private int stoppedNodes;
    private List<NodeStatus> nodes;

    public static ClusterStatus of(String name, List<NodeStatus> members) {
        ClusterStatus status = new ClusterStatus();
        status.setName(name);
        status.setNodes(members);
        status.setTotalNodes(members.size());
        int running = (int) members.stream().filter(NodeStatus::isRunning).count();
        status.setRunningNodes(running);
        status.setStoppedNodes(members.size() - running);
        return status;
    }

    public double getHealthPercentage() {
        return totalNodes > 0 ? (double) runningNodes / totalNodes * 100 : 0;
    }
}
