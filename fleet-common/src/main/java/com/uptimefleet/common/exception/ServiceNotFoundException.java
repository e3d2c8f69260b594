package com.uptimefleet.common.exception;

public class ServiceNotFoundException extends FleetException {

    public ServiceNotFoundException(String serviceId) {
        super(ErrorCode.SERVICE_NOT_FOUND, "Service not found: " + serviceId);
    }
}
