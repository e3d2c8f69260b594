package com.uptimefleet.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of one check (the whole retry sequence, not a single attempt).
 * duration is the latency of the attempt that decided the outcome, in ms.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class MonitoringResult {
    private String serviceId;
    private long timestamp;
    private boolean success;
    private long duration;
    private String error;

    public static MonitoringResult up(String serviceId, long timestamp, long duration) {
        return new MonitoringResult(serviceId, timestamp, true, duration, null);
    }

    public static MonitoringResult down(String serviceId, long timestamp, long duration, String error) {
        return new MonitoringResult(serviceId, timestamp, false, duration, error);
    }
}
