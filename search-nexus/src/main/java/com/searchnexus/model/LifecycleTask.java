package com.searchnexus.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LifecycleTask {
    private String taskId;
    private String nodeName;
    private LifecycleAction action;
    private String sessionId;
    private String status; // "accepted", "polling", "completed", "timed_out", "cancelled"
    private int attempt;
    private int maxAttempts;
    private ReconcileOutcome outcome;
    private String errorCode;
    private String message;
    private long startTime;
    private Long endTime;

    public boolean isFinished() {
        return outcome != null;
    }
}
