package com.searchnexus.model;

public enum ReconcileOutcome {
    CONVERGED,
    TIMED_OUT,
    CANCELLED
}
