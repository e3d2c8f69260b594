package com.uptimefleet.slave.executor;

import com.uptimefleet.common.exception.ErrorCode;
import com.uptimefleet.common.exception.FleetException;
import com.uptimefleet.common.model.MonitorType;
import com.uptimefleet.common.model.MonitoringResult;
import com.uptimefleet.common.model.ServiceConfig;
import com.uptimefleet.slave.probe.Probe;
import com.uptimefleet.slave.probe.ProbeErrorType;
import com.uptimefleet.slave.probe.ProbeResult;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

/**
 * Runs one check for a service: up to retryAttempts probes with a fixed delay
 * between them, stopping at the first success.
 *
 * execute() never throws; every failure ends up in MonitoringResult.error.
 * The reported duration is the latency of the deciding attempt only, the
 * inter-retry delay is not included.
 */
@Slf4j
public class CheckExecutor {

    private final Map<MonitorType, Probe> probes = new EnumMap<>(MonitorType.class);
    private final long defaultTimeoutMs;
    private final int retryAttempts;
    private final long retryDelayMs;

    public CheckExecutor(Collection<? extends Probe> probes, long defaultTimeoutMs,
                         int retryAttempts, long retryDelayMs) {
        for (Probe probe : probes) {
            this.probes.put(probe.type(), probe);
        }
        this.defaultTimeoutMs = defaultTimeoutMs;
        this.retryAttempts = Math.max(1, retryAttempts);
        this.retryDelayMs = Math.max(0, retryDelayMs);
    }

    public MonitoringResult execute(ServiceConfig config) {
        Probe probe = probes.get(config.getType());
        if (probe == null) {
            log.error("No probe available for service {} of type {}", config.getId(), config.getType());
            return MonitoringResult.down(config.getId(), System.currentTimeMillis(), 0,
                    "No probe available for service type " + config.getType());
        }

        long timeoutMs = config.getTimeout() > 0 ? config.getTimeout() : defaultTimeoutMs;
        String lastError = null;
        long decidingLatency = 0;

        for (int attempt = 1; attempt <= retryAttempts; attempt++) {
            ProbeResult probeResult;
            try {
                probeResult = probe.probe(config, timeoutMs);
            } catch (FleetException e) {
                if (e.getErrorCode() == ErrorCode.PROBE_TYPE_MISMATCH) {
                    // configuration error, retrying cannot help
                    log.error("Service {} misconfigured: {}", config.getId(), e.getMessage());
                    return MonitoringResult.down(config.getId(), System.currentTimeMillis(), 0, e.getMessage());
                }
                probeResult = ProbeResult.failure(ProbeErrorType.UNKNOWN, 0, e.getMessage());
            } catch (RuntimeException e) {
                log.warn("Probe for service {} threw unexpectedly: {}", config.getId(), e.toString());
                probeResult = ProbeResult.failure(ProbeErrorType.UNKNOWN, 0,
                        e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }

            decidingLatency = probeResult.getLatencyMs();

            if (probeResult.isSuccess()) {
                log.debug("Service {} is UP ({} ms, attempt {}/{})",
                        config.getId(), decidingLatency, attempt, retryAttempts);
                return MonitoringResult.up(config.getId(), System.currentTimeMillis(), decidingLatency);
            }

            lastError = probeResult.getMessage();
            log.debug("Check attempt {}/{} failed for service {} [{}]: {}",
                    attempt, retryAttempts, config.getId(), probeResult.getErrorType(), lastError);

            if (attempt < retryAttempts) {
                try {
                    Thread.sleep(retryDelayMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    log.warn("Check retry interrupted for service {}", config.getId());
                    break;
                }
            }
        }

        log.info("Service {} ({}) is DOWN after {} attempts: {}",
                config.getName(), config.getId(), retryAttempts, lastError);
        return MonitoringResult.down(config.getId(), System.currentTimeMillis(), decidingLatency,
                lastError != null ? lastError : "Unknown error");
    }

    public int getRetryAttempts() {
        return retryAttempts;
    }

    public long getRetryDelayMs() {
        return retryDelayMs;
    }
}
