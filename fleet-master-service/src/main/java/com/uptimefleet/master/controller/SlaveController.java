package com.uptimefleet.master.controller;

import com.uptimefleet.common.model.SlaveStatus;
import com.uptimefleet.master.service.MonitoringService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequiredArgsConstructor
public class SlaveController {

    private final MonitoringService monitoringService;

    @GetMapping("/slaves")
    public ResponseEntity<List<SlaveStatus>> listSlaves() {
        return ResponseEntity.ok(monitoringService.listSlaves());
    }
}
