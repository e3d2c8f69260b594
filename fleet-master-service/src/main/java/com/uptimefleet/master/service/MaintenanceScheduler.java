package com.uptimefleet.master.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic jobs of the master: liveness sweep and downtime retention
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MaintenanceScheduler {

    private final MonitoringService monitoringService;

    @Scheduled(fixedDelayString = "${fleet.master.heartbeat.check-interval-ms:10000}",
            initialDelayString = "${fleet.master.heartbeat.check-interval-ms:10000}")
    public void checkSlaves() {
        try {
            int moved = monitoringService.sweepLiveness();
            if (moved > 0) {
                log.info("Liveness sweep moved {} services", moved);
            }
        } catch (RuntimeException e) {
            log.error("Liveness sweep failed", e);
        }
    }

    // Daily at 03:00
    @Scheduled(cron = "${fleet.master.retention-cron:0 0 3 * * *}")
    public void pruneDowntime() {
        try {
            monitoringService.pruneRetention();
        } catch (RuntimeException e) {
            log.error("Retention job failed", e);
        }
    }
}
