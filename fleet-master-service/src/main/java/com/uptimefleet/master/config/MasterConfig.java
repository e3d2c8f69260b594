package com.uptimefleet.master.config;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import javax.annotation.PostConstruct;

/**
 * Centralized configuration for the master, bound from fleet.master.*
 * (environment: API_KEY, DATA_DIR, STATE_RETENTION_DAYS, HEARTBEAT_INTERVAL)
 */
@Slf4j
@Configuration
@ConfigurationProperties(prefix = "fleet.master")
@Data
public class MasterConfig {

    // Downtime periods younger than this are never pruned
    public static final int MIN_RETENTION_DAYS = 30;

    private String apiKey = "";
    private String dataDir = "./data";
    private Integer stateRetentionDays = 30;

    // ========== HEARTBEAT ==========
    private HeartbeatConfig heartbeat = new HeartbeatConfig();

    @Data
    public static class HeartbeatConfig {
        private Long intervalSeconds = 30L;
        private Long timeoutMs;                 // defaults to 2x interval
        private Long checkIntervalMs = 10000L;
    }

    // ========== STORAGE ==========
    private StorageConfig storage = new StorageConfig();

    @Data
    public static class StorageConfig {
        private Long saveDebounceMs = 5000L;
        private String fileName = "monitor-state.json";
    }

    // ========== ASSIGNMENT ==========
    private AssignmentConfig assignment = new AssignmentConfig();

    @Data
    public static class AssignmentConfig {
        private Integer replicas = 1;
        private Integer maxServicesPerSlave = 100;
    }

    // ========== SLAVE CLIENT ==========
    private SlaveClientConfig slaveClient = new SlaveClientConfig();

    @Data
    public static class SlaveClientConfig {
        private Long timeoutMs = 5000L;
    }

    @PostConstruct
    public void logConfiguration() {
        if (stateRetentionDays == null || stateRetentionDays < MIN_RETENTION_DAYS) {
            log.warn("STATE_RETENTION_DAYS={} is below the 30 day uptime window, using {}",
                    stateRetentionDays, MIN_RETENTION_DAYS);
        }
    }

    /**
     * Liveness timeout, at least two heartbeat intervals unless set explicitly
     */
    public long heartbeatTimeoutMs() {
        if (heartbeat.getTimeoutMs() != null && heartbeat.getTimeoutMs() > 0) {
            return heartbeat.getTimeoutMs();
        }
        return heartbeat.getIntervalSeconds() * 2000L;
    }

    public int effectiveRetentionDays() {
        return stateRetentionDays == null ? MIN_RETENTION_DAYS : Math.max(stateRetentionDays, MIN_RETENTION_DAYS);
    }
}
