package com.uptimefleet.common.constants;

/**
 * Wire-level names shared by slave and master
 */
public final class FleetConstants {

    private FleetConstants() {
    }

    // Heartbeat / report headers
    public static final String HEADER_SLAVE_ID = "X-Slave-Id";
    public static final String HEADER_SLAVE_NAME = "X-Slave-Name";
    public static final String HEADER_SLAVE_SERVICES = "X-Slave-Services";
    public static final String HEADER_SLAVE_HOST = "X-Slave-Host";
    public static final String HEADER_SLAVE_PORT = "X-Slave-Port";

    public static final String BEARER_PREFIX = "Bearer ";

    // Master endpoints
    public static final String PATH_HEARTBEAT = "/heartbeat";
    public static final String PATH_REPORT = "/report";

    // Slave endpoints
    public static final String PATH_SERVICE = "/service";
    public static final String PATH_HEALTH = "/health";

    public static final String DEFAULT_SLAVE_NAME = "Unnamed Slave";
    public static final String USER_AGENT = "UptimeFleet-Monitor/1.0";
}
