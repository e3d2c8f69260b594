package com.uptimefleet.slave.config;

import com.uptimefleet.common.constants.FleetConstants;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import javax.annotation.PostConstruct;
import java.security.SecureRandom;

/**
 * Centralized configuration for the slave node, bound from fleet.slave.*
 * (environment: SLAVE_ID, SLAVE_NAME, MASTER_URL, API_KEY, ...)
 */
@Slf4j
@Configuration
@ConfigurationProperties(prefix = "fleet.slave")
@Data
public class SlaveConfig {

    private static final String ID_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";

    // ========== IDENTITY ==========
    private String id;
    private String name = FleetConstants.DEFAULT_SLAVE_NAME;
    private String host = "localhost";   // host the master uses to reach this slave

    // ========== MASTER ==========
    private String masterUrl = "http://localhost:3000";
    private String apiKey = "";

    // ========== CHECKS ==========
    private Integer maxConcurrentChecks = 50;
    private Long checkTimeoutMs = 30000L;     // used when a service has no timeout of its own
    private Integer retryAttempts = 3;
    private Long retryDelayMs = 1000L;

    // ========== HEARTBEAT ==========
    private HeartbeatConfig heartbeat = new HeartbeatConfig();

    @Data
    public static class HeartbeatConfig {
        private Long intervalSeconds = 30L;
    }

    // ========== REPORTING ==========
    private ReportConfig report = new ReportConfig();

    @Data
    public static class ReportConfig {
        private Integer retryAttempts = 3;
        private Long retryDelayMs = 1000L;    // multiplied by the attempt number
        private Integer queueCapacity = 1000;
    }

    // ========== TRANSPORT ==========
    private TransportConfig transport = new TransportConfig();

    @Data
    public static class TransportConfig {
        private Long timeoutMs = 5000L;
    }

    @PostConstruct
    public void initializeSlaveId() {
        if (id == null || id.trim().isEmpty()) {
            id = "slave-" + randomSuffix(7);
            log.warn("SLAVE_ID not set, generated id {}", id);
        }
    }

    /**
     * Master endpoint URL without a trailing slash
     */
    public String masterEndpoint(String path) {
        String base = masterUrl.endsWith("/") ? masterUrl.substring(0, masterUrl.length() - 1) : masterUrl;
        return base + path;
    }

    private static String randomSuffix(int length) {
        SecureRandom random = new SecureRandom();
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(ID_ALPHABET.charAt(random.nextInt(ID_ALPHABET.length())));
        }
        return sb.toString();
    }
}
