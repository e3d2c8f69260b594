package com.uptimefleet.master.service;

import com.uptimefleet.common.model.ServiceStatus;
import com.uptimefleet.common.model.SlaveStatus;

import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Least-loaded placement of services on active slaves
 */
public class AssignmentService {

    private final int replicas;
    private final int maxServicesPerSlave;

    public AssignmentService(int replicas, int maxServicesPerSlave) {
        this.replicas = Math.max(1, replicas);
        this.maxServicesPerSlave = maxServicesPerSlave;
    }

    /**
     * Number of services currently assigned to each slave
     */
    public static Map<String, Integer> loadBySlave(Collection<ServiceStatus> statuses) {
        Map<String, Integer> load = new HashMap<>();
        for (ServiceStatus status : statuses) {
            for (String slaveId : status.getAssignedSlaves()) {
                load.merge(slaveId, 1, Integer::sum);
            }
        }
        return load;
    }

    /**
     * Pick up to count slaves, fewest services first (ties by id), skipping
     * the excluded ones and those already at capacity
     */
    public List<String> choose(Collection<SlaveStatus> activeSlaves, Map<String, Integer> load,
                               Set<String> exclude, int count) {
        if (count <= 0) {
            return List.of();
        }
        return activeSlaves.stream()
                .map(SlaveStatus::getId)
                .filter(id -> !exclude.contains(id))
                .filter(id -> load.getOrDefault(id, 0) < maxServicesPerSlave)
                .sorted(Comparator.<String>comparingInt(id -> load.getOrDefault(id, 0))
                        .thenComparing(Comparator.naturalOrder()))
                .limit(count)
                .collect(Collectors.toList());
    }

    /**
     * How many more slaves a service needs to reach the replica target
     */
    public int missingReplicas(ServiceStatus status) {
        return Math.max(0, replicas - status.getAssignedSlaves().size());
    }

    public int getReplicas() {
        return replicas;
    }

    public int getMaxServicesPerSlave() {
        return maxServicesPerSlave;
    }
}
