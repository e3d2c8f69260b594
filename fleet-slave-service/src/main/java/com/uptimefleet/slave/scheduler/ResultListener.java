package com.uptimefleet.slave.scheduler;

import com.uptimefleet.common.model.MonitoringResult;

/**
 * Receives every check result produced by the scheduler
 */
@FunctionalInterface
public interface ResultListener {

    void onResult(MonitoringResult result);
}
