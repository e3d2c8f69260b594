package com.uptimefleet.slave.probe;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Outcome of a single probe attempt
 */
@Data
@AllArgsConstructor
public class ProbeResult {
    private final boolean success;
    private final long latencyMs;
    private final ProbeErrorType errorType;
    private final String message;

    public static ProbeResult success(long latencyMs) {
        return new ProbeResult(true, latencyMs, null, null);
    }

    public static ProbeResult failure(ProbeErrorType errorType, long latencyMs, String message) {
        return new ProbeResult(false, latencyMs, errorType, message);
    }
}
