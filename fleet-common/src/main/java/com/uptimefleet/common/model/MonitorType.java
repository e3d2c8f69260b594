package com.uptimefleet.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of liveness probe a service is checked with
 */
public enum MonitorType {
    HTTP("http"),
    ICMP("icmp");

    private final String value;

    MonitorType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static MonitorType fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (MonitorType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown monitor type: " + value);
    }
}
