package com.uptimefleet.slave.reporter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.uptimefleet.common.constants.FleetConstants;
import com.uptimefleet.common.model.SlaveStats;
import com.uptimefleet.common.security.ApiKeyValidator;
import com.uptimefleet.common.util.JsonUtils;
import com.uptimefleet.slave.config.SlaveConfig;
import com.uptimefleet.slave.registry.ServiceRegistry;
import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import javax.annotation.PostConstruct;
import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Periodically tells the master this slave is alive and which services it
 * is currently running. One attempt per tick: a failed heartbeat is logged
 * and simply retried on the next tick.
 */
@Slf4j
public class HeartbeatSender {

    // header values must stay on one line
    private static final ObjectMapper HEADER_MAPPER =
            JsonUtils.getObjectMapper().copy().disable(SerializationFeature.INDENT_OUTPUT);

    private final SlaveConfig config;
    private final RestTemplate restTemplate;
    private final ServiceRegistry registry;

    @Value("${server.port:3001}")
    private int serverPort;

    private final AtomicInteger successCount = new AtomicInteger(0);
    private final AtomicInteger failureCount = new AtomicInteger(0);
    private volatile int consecutiveFailures = 0;
    private volatile long lastSuccessAt = 0L;

    public HeartbeatSender(SlaveConfig config, RestTemplate restTemplate, ServiceRegistry registry) {
        this.config = config;
        this.restTemplate = restTemplate;
        this.registry = registry;
    }

    @PostConstruct
    public void init() {
        log.info("========================================");
        log.info("Heartbeat Sender initializing for slave {} ({})", config.getId(), config.getName());
        log.info("Master URL: {}", config.getMasterUrl());
        log.info("Heartbeat interval: {} seconds", config.getHeartbeat().getIntervalSeconds());
        log.info("========================================");
    }

    @Scheduled(fixedDelayString = "${fleet.slave.heartbeat.interval-seconds:30}", timeUnit = TimeUnit.SECONDS)
    public void sendHeartbeat() {
        String endpoint = config.masterEndpoint(FleetConstants.PATH_HEARTBEAT);
        try {
            HttpEntity<SlaveStats> entity = new HttpEntity<>(collectStats(), headers());
            ResponseEntity<String> response = restTemplate.postForEntity(endpoint, entity, String.class);

            if (response.getStatusCode().is2xxSuccessful()) {
                successCount.incrementAndGet();
                consecutiveFailures = 0;
                lastSuccessAt = System.currentTimeMillis();
                log.debug("Heartbeat sent successfully ({} services)", registry.size());
                return;
            }
            recordFailure("master answered " + response.getStatusCode());
        } catch (RestClientException e) {
            recordFailure(e.getMessage());
        }
    }

    private void recordFailure(String reason) {
        failureCount.incrementAndGet();
        consecutiveFailures++;
        log.error("Failed to send heartbeat to {} (consecutive failures: {}): {}",
                config.getMasterUrl(), consecutiveFailures, reason);
    }

    HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(HttpHeaders.AUTHORIZATION, ApiKeyValidator.bearer(config.getApiKey()));
        headers.set(FleetConstants.HEADER_SLAVE_ID, config.getId());
        headers.set(FleetConstants.HEADER_SLAVE_NAME, config.getName());
        headers.set(FleetConstants.HEADER_SLAVE_HOST, config.getHost());
        headers.set(FleetConstants.HEADER_SLAVE_PORT, String.valueOf(serverPort));
        try {
            headers.set(FleetConstants.HEADER_SLAVE_SERVICES,
                    HEADER_MAPPER.writeValueAsString(registry.serviceIds()));
        } catch (JsonProcessingException e) {
            log.warn("Could not encode service list for heartbeat: {}", e.getMessage());
        }
        return headers;
    }

    SlaveStats collectStats() {
        Runtime runtime = Runtime.getRuntime();
        OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        double load = os.getSystemLoadAverage();
        return SlaveStats.builder()
                .cpuLoad(load >= 0 ? load : null)
                .memoryUsageMb((runtime.totalMemory() - runtime.freeMemory()) / (1024 * 1024))
                .uptimeMs(ManagementFactory.getRuntimeMXBean().getUptime())
                .build();
    }

    public HeartbeatStats getStats() {
        return HeartbeatStats.builder()
                .slaveId(config.getId())
                .successCount(successCount.get())
                .failureCount(failureCount.get())
                .consecutiveFailures(consecutiveFailures)
                .lastSuccessAt(lastSuccessAt)
                .masterUrl(config.getMasterUrl())
                .build();
    }

    @Builder
    @Data
    public static class HeartbeatStats {
        private final String slaveId;
        private final int successCount;
        private final int failureCount;
        private final int consecutiveFailures;
        private final long lastSuccessAt;
        private final String masterUrl;
    }
}
