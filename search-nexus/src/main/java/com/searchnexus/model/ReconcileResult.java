package com.searchnexus.model;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class ReconcileResult {
    private String nodeName;
    private LifecycleAction action;
    private ReconcileOutcome outcome;
    private int attempts;
    private boolean running; // observed state after the last probe
}
