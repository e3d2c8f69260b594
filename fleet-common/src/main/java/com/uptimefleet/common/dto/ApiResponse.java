package com.uptimefleet.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Small acknowledgement body: {status, message}
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApiResponse {
    public static final String OK = "ok";
    public static final String IGNORED = "ignored";

    private String status;
    private String message;

    public static ApiResponse ok(String message) {
        return new ApiResponse(OK, message);
    }

    public static ApiResponse ignored(String message) {
        return new ApiResponse(IGNORED, message);
    }
}
