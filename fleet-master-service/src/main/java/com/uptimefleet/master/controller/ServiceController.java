package com.uptimefleet.master.controller;

import com.uptimefleet.common.dto.ApiResponse;
import com.uptimefleet.common.dto.ServiceRequest;
import com.uptimefleet.common.model.ServiceStatus;
import com.uptimefleet.master.service.MonitoringService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.validation.Valid;
import java.util.List;

/**
 * Operator API for the monitored services
 */
@Slf4j
@RestController
@RequestMapping("/services")
@RequiredArgsConstructor
public class ServiceController {

    private final MonitoringService monitoringService;

    @PostMapping
    public ResponseEntity<ServiceStatus> createService(@Valid @RequestBody ServiceRequest request) {
        log.info("Creating service {} ({})", request.getName(), request.getType());
        return ResponseEntity.status(HttpStatus.CREATED).body(monitoringService.createService(request));
    }

    @GetMapping
    public ResponseEntity<List<ServiceStatus>> listServices() {
        return ResponseEntity.ok(monitoringService.listServices());
    }

    @GetMapping("/{id}")
    public ResponseEntity<ServiceStatus> getService(@PathVariable("id") String id) {
        return ResponseEntity.ok(monitoringService.getService(id));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse> deleteService(@PathVariable("id") String id) {
        monitoringService.removeService(id);
        return ResponseEntity.ok(ApiResponse.ok("Service " + id + " removed"));
    }
}
