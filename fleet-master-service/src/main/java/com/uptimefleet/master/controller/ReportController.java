package com.uptimefleet.master.controller;

import com.uptimefleet.common.dto.ApiResponse;
import com.uptimefleet.common.dto.ReportRequest;
import com.uptimefleet.master.service.MonitoringService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import javax.validation.Valid;

@RestController
@RequiredArgsConstructor
public class ReportController {

    private final MonitoringService monitoringService;

    /**
     * Ignored results are still answered with 200 so the slave does not retry them
     */
    @PostMapping("/report")
    public ResponseEntity<ApiResponse> report(@Valid @RequestBody ReportRequest request) {
        return ResponseEntity.ok(monitoringService.ingestReport(request));
    }
}
