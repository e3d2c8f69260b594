package com.uptimefleet.common.exception;

/**
 * Error codes grouped by category:
 * - 1xxx: client input
 * - 2xxx: checks and transport
 * - 3xxx: state and persistence
 */
public enum ErrorCode {

    // Client errors (1xxx)
    INVALID_REQUEST(1001, "Invalid request parameters"),
    INVALID_SERVICE_CONFIG(1002, "Invalid service configuration"),
    SERVICE_NOT_FOUND(1003, "Service does not exist"),
    SLAVE_NOT_FOUND(1004, "Slave does not exist"),
    AUTHENTICATION_FAILED(1005, "Authentication failed"),

    // Check and transport errors (2xxx)
    PROBE_TYPE_MISMATCH(2001, "Probe invoked for a service of another type"),
    TRANSPORT_FAILED(2002, "Failed to reach remote node"),

    // State and persistence errors (3xxx)
    SNAPSHOT_WRITE_FAILED(3001, "Failed to write state snapshot"),
    SNAPSHOT_READ_FAILED(3002, "Failed to read state snapshot"),

    UNKNOWN_ERROR(9999, "Unknown error occurred");

    private final int code;
    private final String message;

    ErrorCode(int code, String message) {
        this.code = code;
        this.message = message;
    }

    public int getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
