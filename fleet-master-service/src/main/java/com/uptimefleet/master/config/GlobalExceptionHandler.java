package com.uptimefleet.master.config;

import com.uptimefleet.common.exception.ErrorCode;
import com.uptimefleet.common.exception.FleetException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST endpoints.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(FleetException.class)
    public ResponseEntity<Map<String, Object>> handleFleetException(FleetException ex) {
        log.warn("Fleet Exception: {} - {}", ex.getErrorCode(), ex.getMessage());
        HttpStatus status = mapErrorCodeToHttpStatus(ex.getErrorCode());
        return ResponseEntity.status(status).body(body(ex.getErrorCode(), ex.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        log.warn("Rejected request: {}", message);
        return ResponseEntity.badRequest().body(body(ErrorCode.INVALID_REQUEST, message));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity.badRequest().body(body(ErrorCode.INVALID_REQUEST, "Malformed request body"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected exception", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(body(ErrorCode.UNKNOWN_ERROR, "An unexpected error occurred"));
    }

    private Map<String, Object> body(ErrorCode errorCode, String message) {
        Map<String, Object> response = new HashMap<>();
        response.put("timestamp", LocalDateTime.now());
        response.put("errorCode", errorCode.getCode());
        response.put("errorType", errorCode.name());
        response.put("message", message);
        return response;
    }

    static HttpStatus mapErrorCodeToHttpStatus(ErrorCode errorCode) {
        switch (errorCode) {
            case SERVICE_NOT_FOUND:
            case SLAVE_NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case AUTHENTICATION_FAILED:
                return HttpStatus.UNAUTHORIZED;
            default:
                break;
        }

        int code = errorCode.getCode();
        if (code >= 1000 && code < 2000) {
            return HttpStatus.BAD_REQUEST;
        } else if (code >= 2000 && code < 3000) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        } else {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }
}
