package com.uptimefleet.common.exception;

public class InvalidServiceConfigException extends FleetException {

    public InvalidServiceConfigException(String message) {
        super(ErrorCode.INVALID_SERVICE_CONFIG, message);
    }
}
