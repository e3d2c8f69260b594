package com.uptimefleet.common.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.uptimefleet.common.model.MonitoringResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.constraints.NotBlank;

/**
 * POST {masterUrl}/report body: a monitoring result tagged with the reporting slave
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ReportRequest {

    @NotBlank(message = "serviceId is required")
    private String serviceId;

    private long timestamp;
    private boolean success;
    private long duration;
    private String error;

    @NotBlank(message = "slaveId is required")
    private String slaveId;

    public static ReportRequest of(MonitoringResult result, String slaveId) {
        return ReportRequest.builder()
                .serviceId(result.getServiceId())
                .timestamp(result.getTimestamp())
                .success(result.isSuccess())
                .duration(result.getDuration())
                .error(result.getError())
                .slaveId(slaveId)
                .build();
    }

    public MonitoringResult toResult() {
        return new MonitoringResult(serviceId, timestamp, success, duration, error);
    }
}
