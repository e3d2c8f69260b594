package com.uptimefleet.common.exception;

/**
 * Base exception for the uptime fleet
 */
public class FleetException extends RuntimeException {

    private final ErrorCode errorCode;

    public FleetException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public FleetException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public FleetException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public int getCode() {
        return errorCode.getCode();
    }
}
