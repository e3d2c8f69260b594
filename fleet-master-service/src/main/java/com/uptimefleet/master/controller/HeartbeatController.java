package com.uptimefleet.master.controller;

import com.fasterxml.jackson.core.type.TypeReference;
import com.uptimefleet.common.constants.FleetConstants;
import com.uptimefleet.common.dto.ApiResponse;
import com.uptimefleet.common.exception.ErrorCode;
import com.uptimefleet.common.exception.FleetException;
import com.uptimefleet.common.model.SlaveStats;
import com.uptimefleet.common.model.SlaveStatus;
import com.uptimefleet.common.util.JsonUtils;
import com.uptimefleet.master.service.MonitoringService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import javax.servlet.http.HttpServletRequest;
import java.io.IOException;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Receives slave heartbeats. Identity and the service list travel in
 * X-Slave-* headers, optional runtime stats in the body.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class HeartbeatController {

    private final MonitoringService monitoringService;

    @PostMapping("/heartbeat")
    public ResponseEntity<ApiResponse> heartbeat(
            @RequestHeader(value = FleetConstants.HEADER_SLAVE_ID, required = false) String slaveId,
            @RequestHeader(value = FleetConstants.HEADER_SLAVE_NAME, required = false) String name,
            @RequestHeader(value = FleetConstants.HEADER_SLAVE_SERVICES, required = false) String services,
            @RequestHeader(value = FleetConstants.HEADER_SLAVE_HOST, required = false) String host,
            @RequestHeader(value = FleetConstants.HEADER_SLAVE_PORT, required = false) String port,
            @RequestBody(required = false) SlaveStats stats,
            HttpServletRequest request) {

        if (slaveId == null || slaveId.trim().isEmpty()) {
            throw new FleetException(ErrorCode.INVALID_REQUEST, "Missing " + FleetConstants.HEADER_SLAVE_ID + " header");
        }

        String effectiveHost = host != null && !host.isEmpty() ? host : request.getRemoteAddr();
        SlaveStatus slave = monitoringService.processHeartbeat(slaveId.trim(),
                name != null ? name : FleetConstants.DEFAULT_SLAVE_NAME,
                effectiveHost, parsePort(port), parseServices(slaveId, services), stats);

        log.debug("Heartbeat from slave {} ({} services reported)", slave.getId(), slave.getServices().size());
        return ResponseEntity.ok(ApiResponse.ok("Heartbeat received"));
    }

    /**
     * The list is a JSON array; a plain comma separated list is accepted too
     */
    static Set<String> parseServices(String slaveId, String header) {
        if (header == null) {
            return null;
        }
        String value = header.trim();
        if (value.isEmpty()) {
            return new LinkedHashSet<>();
        }
        if (value.startsWith("[")) {
            try {
                List<String> ids = JsonUtils.getObjectMapper().readValue(value, new TypeReference<List<String>>() {
                });
                return new LinkedHashSet<>(ids);
            } catch (IOException e) {
                log.warn("Unparseable service list from slave {}: {}", slaveId, e.getMessage());
                return null;
            }
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(id -> !id.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    static Integer parsePort(String port) {
        if (port == null || port.trim().isEmpty()) {
            return null;
        }
        try {
            return Integer.valueOf(port.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring invalid slave port header: {}", port);
            return null;
        }
    }
}
