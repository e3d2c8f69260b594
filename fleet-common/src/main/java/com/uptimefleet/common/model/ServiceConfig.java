package com.uptimefleet.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Operator-defined monitoring target.
 * HTTP services carry a url, ICMP services a host.
 * Interval is in seconds, timeout in milliseconds.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ServiceConfig implements Serializable {
    private static final long serialVersionUID = 1L;

    private String id;
    private String name;
    private MonitorType type;
    private String url;
    private String host;
    private long interval;
    private long timeout;

    /**
     * The url for HTTP services, the host for ICMP services
     */
    @JsonIgnore
    public String getTarget() {
        if (type == MonitorType.HTTP) {
            return url;
        }
        if (type == MonitorType.ICMP) {
            return host;
        }
        return null;
    }

    @JsonIgnore
    public long getIntervalMs() {
        return interval * 1000L;
    }
}
