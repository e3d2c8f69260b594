package com.uptimefleet.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.jackson.Jacksonized;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Aggregated uptime state of one service as maintained by the master.
 * Fields missing from a persisted snapshot fall back to the defaults below.
 */
@Data
@Builder(toBuilder = true)
@Jacksonized
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ServiceStatus {

    public static final double FULL_UPTIME = 100.0;

    private String id;
    private String name;
    private MonitorType type;
    private String url;
    private String host;
    private long interval;
    private long timeout;
    private long createdAt;

    // null until the first result has been applied
    private Long lastCheck;

    @Builder.Default
    private boolean lastStatus = true;

    @Builder.Default
    private double uptimePercentage = FULL_UPTIME;

    @Builder.Default
    private double uptimePercentage30d = FULL_UPTIME;

    @Builder.Default
    private Set<String> assignedSlaves = new LinkedHashSet<>();

    // newest result timestamp applied from each reporting slave
    @Builder.Default
    private Map<String, Long> lastCheckBySlave = new LinkedHashMap<>();

    private DowntimePeriod lastDowntime;

    @Builder.Default
    private List<DowntimePeriod> downtimePeriods = new ArrayList<>();

    // Downtime of periods pruned by retention, still counted in the lifetime figure
    @Builder.Default
    private long archivedDowntimeMs = 0L;

    public static ServiceStatus initial(ServiceConfig config, long createdAt) {
        return ServiceStatus.builder()
                .id(config.getId())
                .name(config.getName())
                .type(config.getType())
                .url(config.getType() == MonitorType.HTTP ? config.getUrl() : null)
                .host(config.getType() == MonitorType.ICMP ? config.getHost() : null)
                .interval(config.getInterval())
                .timeout(config.getTimeout())
                .createdAt(createdAt)
                .build();
    }

    @JsonIgnore
    public DowntimePeriod getOpenDowntime() {
        if (downtimePeriods == null || downtimePeriods.isEmpty()) {
            return null;
        }
        DowntimePeriod last = downtimePeriods.get(downtimePeriods.size() - 1);
        return last != null && last.isOpen() ? last : null;
    }

    /**
     * Deep copy, so a published status is never mutated by a later result
     */
    public ServiceStatus copy() {
        List<DowntimePeriod> periods = new ArrayList<>();
        if (downtimePeriods != null) {
            downtimePeriods.stream()
                    .filter(Objects::nonNull)
                    .map(DowntimePeriod::copy)
                    .forEach(periods::add);
        }
        DowntimePeriod lastCopy = null;
        if (lastDowntime != null) {
            // keep lastDowntime pointing into the copied list
            int index = periods.lastIndexOf(lastDowntime);
            lastCopy = index >= 0 ? periods.get(index) : lastDowntime.copy();
        }
        Set<String> slaves = new LinkedHashSet<>();
        if (assignedSlaves != null) {
            assignedSlaves.stream().filter(Objects::nonNull).forEach(slaves::add);
        }
        Map<String, Long> checks = new LinkedHashMap<>();
        if (lastCheckBySlave != null) {
            checks.putAll(lastCheckBySlave);
        }
        return toBuilder()
                .assignedSlaves(slaves)
                .lastCheckBySlave(checks)
                .downtimePeriods(periods)
                .lastDowntime(lastCopy)
                .build();
    }

    /**
     * Repair a partially-shaped snapshot entry: fill null fields, drop null
     * elements, order periods by start and leave at most the last one open.
     */
    public ServiceStatus normalize() {
        if (assignedSlaves == null) {
            assignedSlaves = new LinkedHashSet<>();
        }
        assignedSlaves.removeIf(Objects::isNull);

        if (lastCheckBySlave == null) {
            lastCheckBySlave = new LinkedHashMap<>();
        }
        lastCheckBySlave.entrySet().removeIf(entry -> entry.getKey() == null || entry.getValue() == null);

        if (downtimePeriods == null) {
            downtimePeriods = new ArrayList<>();
        }
        downtimePeriods.removeIf(Objects::isNull);
        downtimePeriods.sort(Comparator.comparingLong(DowntimePeriod::getStart));
        for (int i = 0; i < downtimePeriods.size() - 1; i++) {
            DowntimePeriod period = downtimePeriods.get(i);
            if (period.isOpen()) {
                period.setEnd(downtimePeriods.get(i + 1).getStart());
            }
        }
        if (lastDowntime != null) {
            int index = downtimePeriods.lastIndexOf(lastDowntime);
            if (index >= 0) {
                lastDowntime = downtimePeriods.get(index);
            }
        }

        if (Double.isNaN(uptimePercentage)) {
            uptimePercentage = FULL_UPTIME;
        }
        if (Double.isNaN(uptimePercentage30d)) {
            uptimePercentage30d = FULL_UPTIME;
        }
        return this;
    }
}
