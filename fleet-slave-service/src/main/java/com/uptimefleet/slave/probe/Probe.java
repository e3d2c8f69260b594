package com.uptimefleet.slave.probe;

import com.uptimefleet.common.exception.ErrorCode;
import com.uptimefleet.common.exception.FleetException;
import com.uptimefleet.common.model.MonitorType;
import com.uptimefleet.common.model.ServiceConfig;

/**
 * One liveness test against a target. Network failures are returned as a
 * failed ProbeResult; being handed a service of another type is a
 * programming error and throws.
 */
public interface Probe {

    MonitorType type();

    ProbeResult probe(ServiceConfig config, long timeoutMs);

    default void requireType(ServiceConfig config) {
        if (config.getType() != type()) {
            throw new FleetException(ErrorCode.PROBE_TYPE_MISMATCH,
                    "Invalid service type: expected " + type().getValue().toUpperCase()
                            + " service, got " + config.getType() + " for service " + config.getId());
        }
    }
}
