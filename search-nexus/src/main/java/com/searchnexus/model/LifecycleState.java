package com.searchnexus.model;

public enum LifecycleState {
    STOPPED,
    STARTING,
    RUNNING,
    STOPPING,
    UNREACHABLE
}
