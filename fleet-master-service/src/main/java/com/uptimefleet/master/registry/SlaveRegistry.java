package com.uptimefleet.master.registry;

import com.uptimefleet.common.model.SlaveStats;
import com.uptimefleet.common.model.SlaveStatus;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Tracks slaves by their heartbeats.
 *
 * isActive is never stored: it is derived from lastHeartbeat on every read.
 * The registry only remembers which slaves it last saw active so the sweep
 * can report transitions.
 */
@Slf4j
public class SlaveRegistry {

    private final ConcurrentHashMap<String, SlaveStatus> slaves = new ConcurrentHashMap<>();
    private final Set<String> seenActive = ConcurrentHashMap.newKeySet();
    private final long heartbeatTimeoutMs;

    public SlaveRegistry(long heartbeatTimeoutMs) {
        this.heartbeatTimeoutMs = heartbeatTimeoutMs;
    }

    /**
     * Record a heartbeat. reportedServices may be null when the slave did not
     * send its service list, in which case the previous list is kept.
     *
     * @return the slave as stored, with isActive derived at currentTime
     */
    public SlaveStatus heartbeat(String slaveId, String name, String host, Integer port,
                                 Set<String> reportedServices, SlaveStats stats, long currentTime) {
        SlaveStatus updated = slaves.compute(slaveId, (id, current) -> {
            SlaveStatus next = current == null
                    ? SlaveStatus.builder().id(id).services(new LinkedHashSet<>()).build()
                    : current.copy();
            if (current == null) {
                log.info("New slave registered: {} ({}) at {}:{}", id, name, host, port);
            }
            if (name != null) {
                next.setName(name);
            }
            if (host != null) {
                next.setHost(host);
            }
            if (port != null) {
                next.setPort(port);
            }
            if (reportedServices != null) {
                next.setServices(new LinkedHashSet<>(reportedServices));
            }
            if (stats != null) {
                next.setStats(stats);
            }
            next.setLastHeartbeat(Math.max(next.getLastHeartbeat(), currentTime));
            return next;
        });

        if (seenActive.add(slaveId)) {
            log.info("Slave {} ({}) is ACTIVE", slaveId, updated.getName());
        }
        return withActive(updated, currentTime);
    }

    public boolean isActive(SlaveStatus slave, long currentTime) {
        return slave != null && currentTime - slave.getLastHeartbeat() < heartbeatTimeoutMs;
    }

    public boolean isActive(String slaveId, long currentTime) {
        return isActive(slaves.get(slaveId), currentTime);
    }

    public Optional<SlaveStatus> get(String slaveId, long currentTime) {
        SlaveStatus slave = slaves.get(slaveId);
        return slave == null ? Optional.empty() : Optional.of(withActive(slave, currentTime));
    }

    public List<SlaveStatus> list(long currentTime) {
        return slaves.values().stream()
                .map(slave -> withActive(slave, currentTime))
                .collect(Collectors.toList());
    }

    public List<SlaveStatus> activeSlaves(long currentTime) {
        return list(currentTime).stream()
                .filter(SlaveStatus::isActive)
                .collect(Collectors.toList());
    }

    /**
     * Find slaves that went from active to inactive since the last sweep
     */
    public List<SlaveStatus> sweep(long currentTime) {
        List<SlaveStatus> lost = new ArrayList<>();
        for (SlaveStatus slave : slaves.values()) {
            if (!isActive(slave, currentTime) && seenActive.remove(slave.getId())) {
                log.warn("========================================");
                log.warn("SLAVE LOST: {} ({}), last heartbeat {} ms ago", slave.getId(), slave.getName(),
                        currentTime - slave.getLastHeartbeat());
                log.warn("========================================");
                lost.add(withActive(slave, currentTime));
            }
        }
        return lost;
    }

    /**
     * Load slaves from a snapshot. Their activity is still derived from the
     * persisted lastHeartbeat, so long-gone slaves come back inactive.
     */
    public void restore(Collection<SlaveStatus> restored, long currentTime) {
        slaves.clear();
        seenActive.clear();
        for (SlaveStatus slave : restored) {
            if (slave == null || slave.getId() == null) {
                continue;
            }
            SlaveStatus copy = slave.copy().normalize();
            slaves.put(copy.getId(), copy);
            if (isActive(copy, currentTime)) {
                seenActive.add(copy.getId());
            }
        }
        log.info("Restored {} slaves ({} still within heartbeat timeout)", slaves.size(), seenActive.size());
    }

    public int size() {
        return slaves.size();
    }

    public long getHeartbeatTimeoutMs() {
        return heartbeatTimeoutMs;
    }

    private SlaveStatus withActive(SlaveStatus slave, long currentTime) {
        SlaveStatus copy = slave.copy();
        copy.setActive(isActive(slave, currentTime));
        return copy;
    }
}
