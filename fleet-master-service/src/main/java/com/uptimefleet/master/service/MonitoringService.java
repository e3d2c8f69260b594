package com.uptimefleet.master.service;

import com.uptimefleet.common.dto.ApiResponse;
import com.uptimefleet.common.dto.ReportRequest;
import com.uptimefleet.common.dto.ServiceRequest;
import com.uptimefleet.common.exception.InvalidServiceConfigException;
import com.uptimefleet.common.exception.ServiceNotFoundException;
import com.uptimefleet.common.model.ServiceConfig;
import com.uptimefleet.common.model.ServiceStatus;
import com.uptimefleet.common.model.SlaveStats;
import com.uptimefleet.common.model.SlaveStatus;
import com.uptimefleet.common.util.ServiceConfigValidator;
import com.uptimefleet.master.client.SlaveClient;
import com.uptimefleet.master.registry.SlaveRegistry;
import com.uptimefleet.master.state.UptimeStateEngine;
import com.uptimefleet.master.storage.DurableStore;
import com.uptimefleet.master.storage.StorageSnapshot;
import lombok.extern.slf4j.Slf4j;

import javax.annotation.PostConstruct;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Coordinates the master: service lifecycle, result ingestion, heartbeats,
 * assignment and persistence.
 *
 * The master's assignment is authoritative. A slave's self-reported service
 * list is reconciled toward it on every heartbeat: assigned services the
 * slave is missing are pushed again and services it runs without being
 * assigned are revoked.
 */
@Slf4j
public class MonitoringService {

    private final UptimeStateEngine engine;
    private final SlaveRegistry slaveRegistry;
    private final DurableStore store;
    private final SlaveClient slaveClient;
    private final AssignmentService assignmentService;
    private final Clock clock;
    private final int retentionDays;

    private final ConcurrentHashMap<String, ServiceConfig> configs = new ConcurrentHashMap<>();

    // placement decisions read the load of every slave, so they are made one at a time
    private final Object assignmentLock = new Object();

    public MonitoringService(UptimeStateEngine engine, SlaveRegistry slaveRegistry, DurableStore store,
                             SlaveClient slaveClient, AssignmentService assignmentService,
                             Clock clock, int retentionDays) {
        this.engine = engine;
        this.slaveRegistry = slaveRegistry;
        this.store = store;
        this.slaveClient = slaveClient;
        this.assignmentService = assignmentService;
        this.clock = clock;
        this.retentionDays = retentionDays;
    }

    /**
     * Restore configs, statuses and slaves from the last snapshot
     */
    @PostConstruct
    public void init() {
        StorageSnapshot snapshot = store.load();
        long now = clock.millis();

        configs.clear();
        List<ServiceStatus> statuses = new ArrayList<>();
        for (Map.Entry<String, ServiceConfig> entry : snapshot.getServiceConfigs().entrySet()) {
            ServiceConfig config = entry.getValue();
            if (config.getId() == null) {
                config.setId(entry.getKey());
            }
            configs.put(config.getId(), config);

            ServiceStatus status = snapshot.getServiceStatuses().get(config.getId());
            if (status == null) {
                log.warn("No status stored for service {}, starting it at 100%", config.getId());
                status = ServiceStatus.initial(config, now);
            }
            statuses.add(status);
        }

        int orphans = snapshot.getServiceStatuses().size() - statuses.size();
        if (orphans > 0) {
            log.warn("Dropping {} stored statuses without a service config", orphans);
        }

        engine.restore(statuses);
        slaveRegistry.restore(snapshot.getSlaveStatuses().values(), now);

        log.info("========================================");
        log.info("Monitoring Service initialized");
        log.info("Services: {}, Slaves: {}", configs.size(), slaveRegistry.size());
        log.info("Heartbeat timeout: {} ms", slaveRegistry.getHeartbeatTimeoutMs());
        log.info("Replicas per service: {}, max services per slave: {}",
                assignmentService.getReplicas(), assignmentService.getMaxServicesPerSlave());
        log.info("State retention: {} days", retentionDays);
        log.info("========================================");
    }

    // ==================== SERVICES ====================

    public ServiceStatus createService(ServiceRequest request) {
        ServiceConfig config = request.toConfig();
        if (config.getId() == null || config.getId().trim().isEmpty()) {
            config.setId(UUID.randomUUID().toString());
        }
        ServiceConfigValidator.validate(config);

        if (configs.putIfAbsent(config.getId(), config) != null) {
            throw new InvalidServiceConfigException("Service already exists: " + config.getId());
        }
        engine.register(config, clock.millis());
        assign(config.getId());
        requestSave();

        return engine.get(config.getId()).orElseThrow(() -> new ServiceNotFoundException(config.getId()));
    }

    public ServiceStatus getService(String serviceId) {
        return engine.get(serviceId).orElseThrow(() -> new ServiceNotFoundException(serviceId));
    }

    public List<ServiceStatus> listServices() {
        return engine.all();
    }

    /**
     * Revoke the service from its slaves and forget it. Results still in
     * flight for it are dropped by the engine afterwards.
     */
    public void removeService(String serviceId) {
        if (configs.remove(serviceId) == null) {
            throw new ServiceNotFoundException(serviceId);
        }
        Optional<ServiceStatus> removed = engine.remove(serviceId);
        long now = clock.millis();
        removed.ifPresent(status -> status.getAssignedSlaves().forEach(slaveId ->
                slaveRegistry.get(slaveId, now).ifPresent(slave -> slaveClient.revokeService(slave, serviceId))));
        log.info("Removed service {}", serviceId);
        requestSave();
    }

    // ==================== REPORTS ====================

    /**
     * Feed a slave's result into the state engine. Results for unknown
     * services, from slaves not assigned to the service, or older than the
     * last applied one are acknowledged and ignored.
     */
    public ApiResponse ingestReport(ReportRequest request) {
        String serviceId = request.getServiceId();
        Optional<ServiceStatus> current = engine.get(serviceId);
        if (!configs.containsKey(serviceId) || !current.isPresent()) {
            log.debug("Ignoring report from slave {} for unknown service {}", request.getSlaveId(), serviceId);
            return ApiResponse.ignored("Unknown service " + serviceId);
        }
        if (!current.get().getAssignedSlaves().contains(request.getSlaveId())) {
            log.warn("Ignoring report for service {} from unassigned slave {}", serviceId, request.getSlaveId());
            return ApiResponse.ignored("Slave " + request.getSlaveId() + " is not assigned to service " + serviceId);
        }

        Optional<ServiceStatus> updated = engine.apply(request.toResult(), request.getSlaveId(), clock.millis());
        if (!updated.isPresent()) {
            return ApiResponse.ignored("Stale or duplicate result for service " + serviceId);
        }
        log.debug("Applied result for service {} from slave {}: success={}, uptime={}%",
                serviceId, request.getSlaveId(), request.isSuccess(), updated.get().getUptimePercentage());
        requestSave();
        return ApiResponse.ok("Result recorded");
    }

    // ==================== HEARTBEATS ====================

    /**
     * Record a heartbeat, reconcile the slave's services and place any
     * services still waiting for a slave.
     *
     * @param reportedServices null when the slave did not send its list
     */
    public SlaveStatus processHeartbeat(String slaveId, String name, String host, Integer port,
                                        Set<String> reportedServices, SlaveStats stats) {
        SlaveStatus slave = slaveRegistry.heartbeat(slaveId, name, host, port, reportedServices, stats, clock.millis());
        if (reportedServices != null) {
            reconcile(slave, reportedServices);
        }
        assignUnassigned();
        requestSave();
        return slave;
    }

    void reconcile(SlaveStatus slave, Set<String> reported) {
        Set<String> assigned = assignedTo(slave.getId());

        for (String serviceId : assigned) {
            if (!reported.contains(serviceId)) {
                ServiceConfig config = configs.get(serviceId);
                if (config != null) {
                    log.info("Slave {} is not running assigned service {}, pushing it again", slave.getId(), serviceId);
                    slaveClient.pushService(slave, config);
                }
            }
        }
        for (String serviceId : reported) {
            if (!assigned.contains(serviceId)) {
                log.info("Slave {} runs unassigned service {}, revoking it", slave.getId(), serviceId);
                slaveClient.revokeService(slave, serviceId);
            }
        }
    }

    private Set<String> assignedTo(String slaveId) {
        return engine.all().stream()
                .filter(status -> status.getAssignedSlaves().contains(slaveId))
                .map(ServiceStatus::getId)
                .collect(Collectors.toCollection(HashSet::new));
    }

    // ==================== ASSIGNMENT ====================

    /**
     * Place a service on as many extra slaves as it needs
     *
     * @return true if at least one slave was added
     */
    boolean assign(String serviceId) {
        long now = clock.millis();
        List<String> chosen;
        synchronized (assignmentLock) {
            Optional<ServiceStatus> status = engine.get(serviceId);
            if (!status.isPresent()) {
                return false;
            }
            int missing = assignmentService.missingReplicas(status.get());
            if (missing == 0) {
                return false;
            }
            chosen = assignmentService.choose(slaveRegistry.activeSlaves(now),
                    AssignmentService.loadBySlave(engine.all()), status.get().getAssignedSlaves(), missing);
            if (chosen.isEmpty()) {
                log.warn("No eligible slave for service {}, leaving it unassigned", serviceId);
                return false;
            }
            engine.updateAssignment(serviceId, slaves -> {
                slaves.addAll(chosen);
                return slaves;
            });
        }

        ServiceConfig config = configs.get(serviceId);
        for (String slaveId : chosen) {
            log.info("Assigned service {} to slave {}", serviceId, slaveId);
            if (config != null) {
                slaveRegistry.get(slaveId, now).ifPresent(slave -> slaveClient.pushService(slave, config));
            }
        }
        return true;
    }

    void assignUnassigned() {
        for (ServiceStatus status : engine.all()) {
            if (assignmentService.missingReplicas(status) > 0) {
                assign(status.getId());
            }
        }
    }

    // ==================== MAINTENANCE ====================

    /**
     * Move services off slaves that stopped heartbeating. A service keeps its
     * slave when no other one can take it.
     */
    public int sweepLiveness() {
        long now = clock.millis();
        int moved = 0;
        for (SlaveStatus lost : slaveRegistry.sweep(now)) {
            for (String serviceId : assignedTo(lost.getId())) {
                if (handOff(serviceId, lost.getId(), now)) {
                    moved++;
                }
            }
        }
        if (moved > 0) {
            requestSave();
        }
        return moved;
    }

    private boolean handOff(String serviceId, String lostSlaveId, long now) {
        String target;
        synchronized (assignmentLock) {
            Optional<ServiceStatus> status = engine.get(serviceId);
            if (!status.isPresent()) {
                return false;
            }
            List<String> chosen = assignmentService.choose(slaveRegistry.activeSlaves(now),
                    AssignmentService.loadBySlave(engine.all()), status.get().getAssignedSlaves(), 1);
            if (chosen.isEmpty()) {
                log.warn("No slave can take over service {} from {}, keeping the assignment", serviceId, lostSlaveId);
                return false;
            }
            target = chosen.get(0);
            engine.updateAssignment(serviceId, slaves -> {
                slaves.remove(lostSlaveId);
                slaves.add(target);
                return slaves;
            });
        }

        log.info("Handed off service {} from slave {} to slave {}", serviceId, lostSlaveId, target);
        ServiceConfig config = configs.get(serviceId);
        if (config != null) {
            slaveRegistry.get(target, now).ifPresent(slave -> slaveClient.pushService(slave, config));
        }
        return true;
    }

    /**
     * Prune closed downtime periods older than the retention window
     */
    public int pruneRetention() {
        long cutoff = clock.millis() - TimeUnit.DAYS.toMillis(retentionDays);
        int pruned = engine.pruneRetention(cutoff);
        if (pruned > 0) {
            log.info("Retention pruned {} downtime periods older than {} days", pruned, retentionDays);
            requestSave();
        }
        return pruned;
    }

    // ==================== SLAVES / STATE ====================

    public List<SlaveStatus> listSlaves() {
        return slaveRegistry.list(clock.millis());
    }

    public int activeSlaveCount() {
        return slaveRegistry.activeSlaves(clock.millis()).size();
    }

    public StorageSnapshot snapshot() {
        Map<String, ServiceStatus> statuses = new LinkedHashMap<>();
        engine.all().forEach(status -> statuses.put(status.getId(), status));
        Map<String, SlaveStatus> slaves = new LinkedHashMap<>();
        slaveRegistry.list(clock.millis()).forEach(slave -> slaves.put(slave.getId(), slave));

        return StorageSnapshot.builder()
                .serviceConfigs(new LinkedHashMap<>(configs))
                .serviceStatuses(statuses)
                .slaveStatuses(slaves)
                .build();
    }

    public Map<String, ServiceConfig> getConfigs() {
        return Collections.unmodifiableMap(configs);
    }

    private void requestSave() {
        store.requestSave(this::snapshot);
    }
}
