package com.uptimefleet.master.controller;

import com.uptimefleet.common.dto.ApiResponse;
import com.uptimefleet.master.service.MonitoringService;
import com.uptimefleet.master.storage.DurableStore;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unauthenticated health check
 */
@RestController
@RequiredArgsConstructor
public class HealthController {

    private final MonitoringService monitoringService;
    private final DurableStore durableStore;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", ApiResponse.OK);
        health.put("services", monitoringService.listServices().size());
        health.put("slaves", monitoringService.listSlaves().size());
        health.put("activeSlaves", monitoringService.activeSlaveCount());
        health.put("stateWrites", durableStore.getWriteCount());
        health.put("stateWriteFailures", durableStore.getFailureCount());
        return ResponseEntity.ok(health);
    }
}
