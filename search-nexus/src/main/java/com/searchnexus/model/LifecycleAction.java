package com.searchnexus.model;

public enum LifecycleAction {
    START(true, LifecycleState.STARTING, LifecycleState.RUNNING),
    STOP(false, LifecycleState.STOPPING, LifecycleState.STOPPED);

    private final boolean desiredRunning;
    private final LifecycleState transitionalState;
    private final LifecycleState settledState;

    LifecycleAction(boolean desiredRunning, LifecycleState transitionalState, LifecycleState settledState) {
        this.desiredRunning = desiredRunning;
        this.transitionalState = transitionalState;
        this.settledState = settledState;
    }

    public boolean isDesiredRunning() {
        return desiredRunning;
    }

    public LifecycleState getTransitionalState() {
        return transitionalState;
    }

    public LifecycleState getSettledState() {
        return settledState;
    }
}
