package com.uptimefleet.master.client;

import com.uptimefleet.common.constants.FleetConstants;
import com.uptimefleet.common.dto.ServiceRequest;
import com.uptimefleet.common.model.ServiceConfig;
import com.uptimefleet.common.model.SlaveStatus;
import com.uptimefleet.common.security.ApiKeyValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP client for pushing and revoking service assignments on slaves.
 * Failures are logged and reported as false; reconciliation on the next
 * heartbeat retries them.
 */
@Slf4j
public class SlaveClient {

    private final RestTemplate restTemplate;
    private final String apiKey;

    public SlaveClient(RestTemplate restTemplate, String apiKey) {
        this.restTemplate = restTemplate;
        this.apiKey = apiKey;
    }

    /**
     * POST {slave}/service
     */
    public boolean pushService(SlaveStatus slave, ServiceConfig config) {
        String baseUrl = slave.baseUrl();
        if (baseUrl == null) {
            log.warn("Cannot push service {} to slave {}: no address known", config.getId(), slave.getId());
            return false;
        }

        String endpoint = baseUrl + FleetConstants.PATH_SERVICE;
        try {
            HttpEntity<ServiceRequest> entity = new HttpEntity<>(ServiceRequest.from(config), headers());
            ResponseEntity<String> response = restTemplate.exchange(endpoint, HttpMethod.POST, entity, String.class);
            if (response.getStatusCode().is2xxSuccessful()) {
                log.info("Pushed service {} to slave {}", config.getId(), slave.getId());
                return true;
            }
            log.warn("Slave {} rejected service {}: {}", slave.getId(), config.getId(), response.getStatusCode());
            return false;
        } catch (RestClientException e) {
            log.error("Failed to push service {} to slave {} at {}: {}",
                    config.getId(), slave.getId(), baseUrl, e.getMessage());
            return false;
        }
    }

    /**
     * DELETE {slave}/service/{id}. A 404 counts as revoked.
     */
    public boolean revokeService(SlaveStatus slave, String serviceId) {
        String baseUrl = slave.baseUrl();
        if (baseUrl == null) {
            log.warn("Cannot revoke service {} from slave {}: no address known", serviceId, slave.getId());
            return false;
        }

        String endpoint = baseUrl + FleetConstants.PATH_SERVICE + "/" + serviceId;
        try {
            restTemplate.exchange(endpoint, HttpMethod.DELETE, new HttpEntity<>(headers()), String.class);
            log.info("Revoked service {} from slave {}", serviceId, slave.getId());
            return true;
        } catch (HttpClientErrorException e) {
            if (e.getStatusCode() == HttpStatus.NOT_FOUND) {
                log.debug("Service {} was already gone from slave {}", serviceId, slave.getId());
                return true;
            }
            log.error("Slave {} refused to revoke service {}: {}", slave.getId(), serviceId, e.getStatusCode());
            return false;
        } catch (RestClientException e) {
            log.error("Failed to revoke service {} from slave {} at {}: {}",
                    serviceId, slave.getId(), baseUrl, e.getMessage());
            return false;
        }
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (apiKey != null && !apiKey.isEmpty()) {
            headers.set(HttpHeaders.AUTHORIZATION, ApiKeyValidator.bearer(apiKey));
        }
        return headers;
    }
}
