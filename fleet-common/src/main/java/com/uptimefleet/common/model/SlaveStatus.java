package com.uptimefleet.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A worker as seen by the master. active is derived from lastHeartbeat on
 * every read and is ignored when a snapshot is loaded.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class SlaveStatus {
    private String id;
    private String name;
    private String host;
    private Integer port;
    private long lastHeartbeat;

    @JsonProperty(value = "isActive", access = JsonProperty.Access.READ_ONLY)
    private boolean active;

    // Service ids the slave itself reported in its last heartbeat
    private Set<String> services;

    private SlaveStats stats;

    /**
     * Base URL the master uses to push assignments, null if unknown
     */
    public String baseUrl() {
        if (host == null || host.isEmpty() || port == null) {
            return null;
        }
        return "http://" + host + ":" + port;
    }

    public SlaveStatus normalize() {
        if (services == null) {
            services = new LinkedHashSet<>();
        }
        return this;
    }

    public SlaveStatus copy() {
        return toBuilder()
                .services(services != null ? new LinkedHashSet<>(services) : new LinkedHashSet<>())
                .build();
    }
}
