package com.uptimefleet.slave.controller;

import com.uptimefleet.common.dto.ApiResponse;
import com.uptimefleet.common.dto.ServiceRequest;
import com.uptimefleet.common.exception.ServiceNotFoundException;
import com.uptimefleet.common.model.ServiceConfig;
import com.uptimefleet.common.util.ServiceConfigValidator;
import com.uptimefleet.slave.config.SlaveConfig;
import com.uptimefleet.slave.registry.ServiceRegistry;
import com.uptimefleet.slave.reporter.HeartbeatSender;
import com.uptimefleet.slave.reporter.MasterReporter;
import com.uptimefleet.slave.scheduler.CheckScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import javax.validation.Valid;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Endpoints the master uses to push and revoke service assignments
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class SlaveController {

    private final SlaveConfig config;
    private final ServiceRegistry registry;
    private final CheckScheduler checkScheduler;
    private final MasterReporter masterReporter;
    private final HeartbeatSender heartbeatSender;

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Collections.singletonMap("status", ApiResponse.OK));
    }

    /**
     * Add (or replace) a service and start checking it right away
     */
    @PostMapping("/service")
    public ResponseEntity<ApiResponse> addService(@Valid @RequestBody ServiceRequest request) {
        ServiceConfig service = request.toConfig();
        ServiceConfigValidator.validate(service);

        boolean replaced = registry.contains(service.getId());
        checkScheduler.schedule(service);
        log.info("{} service {} ({}, {}s interval)", replaced ? "Replaced" : "Added",
                service.getId(), service.getTarget(), service.getInterval());

        return ResponseEntity.ok(ApiResponse.ok(
                "Service " + service.getId() + " added and monitoring started"));
    }

    @DeleteMapping("/service/{id}")
    public ResponseEntity<ApiResponse> removeService(@PathVariable("id") String id) {
        if (!checkScheduler.unschedule(id)) {
            throw new ServiceNotFoundException(id);
        }
        log.info("Removed service {}", id);
        return ResponseEntity.ok(ApiResponse.ok("Service " + id + " removed"));
    }

    @GetMapping("/services")
    public ResponseEntity<List<ServiceConfig>> listServices() {
        return ResponseEntity.ok(registry.list());
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> stats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("slaveId", config.getId());
        stats.put("name", config.getName());
        stats.put("services", registry.size());
        stats.put("reportsSent", masterReporter.getSentCount());
        stats.put("reportsFailed", masterReporter.getFailedCount());
        stats.put("reportsDropped", masterReporter.getDroppedCount());
        stats.put("heartbeat", heartbeatSender.getStats());
        return ResponseEntity.ok(stats);
    }
}
