package com.uptimefleet.common.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.uptimefleet.common.model.MonitorType;
import com.uptimefleet.common.model.ServiceConfig;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.Positive;

/**
 * Body of a service registration, used by the slave's POST /service and the
 * master's POST /services. The master generates an id when none is given.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ServiceRequest {

    private String id;

    @NotBlank(message = "name is required")
    private String name;

    @NotNull(message = "type is required")
    private MonitorType type;

    @Positive(message = "interval must be greater than 0")
    private long interval;

    @Positive(message = "timeout must be greater than 0")
    private long timeout;

    private String url;
    private String host;

    public static ServiceRequest from(ServiceConfig config) {
        return ServiceRequest.builder()
                .id(config.getId())
                .name(config.getName())
                .type(config.getType())
                .interval(config.getInterval())
                .timeout(config.getTimeout())
                .url(config.getUrl())
                .host(config.getHost())
                .build();
    }

    public ServiceConfig toConfig() {
        return ServiceConfig.builder()
                .id(id)
                .name(name)
                .type(type)
                .interval(interval)
                .timeout(timeout)
                .url(type == MonitorType.HTTP ? url : null)
                .host(type == MonitorType.ICMP ? host : null)
                .build();
    }
}
