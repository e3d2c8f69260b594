package com.uptimefleet.slave.probe;

/**
 * Classification of a failed probe attempt
 */
public enum ProbeErrorType {
    TIMEOUT,
    CONNECTION_FAILED,
    TLS_FAILURE,
    HTTP_STATUS,
    MALFORMED_RESPONSE,
    UNREACHABLE,
    PERMISSION_DENIED,
    INVALID_TARGET,
    UNKNOWN
}
