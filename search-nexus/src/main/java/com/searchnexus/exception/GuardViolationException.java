package com.searchnexus.exception;

import com.searchnexus.model.LifecycleState;
import lombok.Getter;

@Getter
public class GuardViolationException extends NexusException {

    private final String nodeName;
    private final LifecycleState blockingState;

    public GuardViolationException(String nodeName, LifecycleState blockingState) {
        super(NexusErrorCode.NODE_RUNNING, "Node \"" + nodeName + "\" is " + blockingState.name().toLowerCase()
                + ". Stop the node first.");
        this.nodeName = nodeName;
        this.blockingState = blockingState;
        with("nodeName", nodeName);
        with("state", blockingState);
    }
}
