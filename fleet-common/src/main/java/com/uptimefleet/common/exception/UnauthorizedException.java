package com.uptimefleet.common.exception;

public class UnauthorizedException extends FleetException {

    public UnauthorizedException(String message) {
        super(ErrorCode.AUTHENTICATION_FAILED, message);
    }
}
