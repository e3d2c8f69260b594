package com.uptimefleet.master.storage;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.uptimefleet.common.model.ServiceConfig;
import com.uptimefleet.common.model.ServiceStatus;
import com.uptimefleet.common.model.SlaveStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.jackson.Jacksonized;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The unit of durable persistence: everything the master needs to resume
 * after a restart, keyed by id.
 */
@Data
@Builder
@Jacksonized
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class StorageSnapshot {

    @Builder.Default
    private Map<String, ServiceConfig> serviceConfigs = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, ServiceStatus> serviceStatuses = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, SlaveStatus> slaveStatuses = new LinkedHashMap<>();

    private Long lastUpdated;

    public static StorageSnapshot empty() {
        return StorageSnapshot.builder().build();
    }

    /**
     * Fill whatever an older or hand-edited file left out
     */
    public StorageSnapshot normalize() {
        if (serviceConfigs == null) {
            serviceConfigs = new LinkedHashMap<>();
        }
        if (serviceStatuses == null) {
            serviceStatuses = new LinkedHashMap<>();
        }
        if (slaveStatuses == null) {
            slaveStatuses = new LinkedHashMap<>();
        }
        serviceConfigs.values().removeIf(config -> config == null);
        serviceStatuses.values().removeIf(status -> status == null);
        slaveStatuses.values().removeIf(slave -> slave == null);
        serviceStatuses.values().forEach(ServiceStatus::normalize);
        slaveStatuses.values().forEach(SlaveStatus::normalize);
        return this;
    }
}
