package com.searchnexus.model;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class ProbeResult {
    private boolean running;
    private Long pid; // null when the supervisor cannot tell

    public static ProbeResult stopped() {
        return new ProbeResult(false, null);
    }
}
