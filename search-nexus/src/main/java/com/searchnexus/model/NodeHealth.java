package com.searchnexus.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class NodeHealth {
    private String nodeName;
    private LifecycleState state;
    private boolean running;
    private Long pid;
    private long lastCheckTime;
    private int consecutiveFailures;

    public static NodeHealth unknown(String nodeName) {
        return new NodeHealth(nodeName, LifecycleState.STOPPED, false, null, 0L, 0);
    }

    public NodeHealth copy() {
        return new NodeHealth(nodeName, state, running, pid, lastCheckTime, consecutiveFailures);
    }
}
