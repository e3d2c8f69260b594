package com.uptimefleet.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A contiguous outage. end == null while the outage is still open.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DowntimePeriod {
    private long start;
    private Long end;

    public static DowntimePeriod open(long start) {
        return new DowntimePeriod(start, null);
    }

    @JsonIgnore
    public boolean isOpen() {
        return end == null;
    }

    /**
     * Length of the outage, counting an open period up to currentTime
     */
    public long durationUntil(long currentTime) {
        long effectiveEnd = end != null ? end : currentTime;
        return Math.max(0, effectiveEnd - start);
    }

    public DowntimePeriod copy() {
        return new DowntimePeriod(start, end);
    }
}
