package com.uptimefleet.slave.reporter;

import com.uptimefleet.common.constants.FleetConstants;
import com.uptimefleet.common.dto.ReportRequest;
import com.uptimefleet.common.model.MonitoringResult;
import com.uptimefleet.common.security.ApiKeyValidator;
import com.uptimefleet.slave.config.SlaveConfig;
import com.uptimefleet.slave.scheduler.ResultListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Delivers check results to the master's /report endpoint.
 *
 * Delivery runs on its own executor so a slow master never holds up check
 * scheduling. Transport failures are retried with a linear backoff
 * (retryDelayMs x attempt); once the budget is spent the result is dropped,
 * the next check of that service produces a fresh one.
 */
@Slf4j
public class MasterReporter implements ResultListener {

    private final SlaveConfig config;
    private final RestTemplate restTemplate;
    private final Executor reportExecutor;

    private final AtomicLong sentCount = new AtomicLong();
    private final AtomicLong failedCount = new AtomicLong();
    private final AtomicLong droppedCount = new AtomicLong();

    public MasterReporter(SlaveConfig config, RestTemplate restTemplate, Executor reportExecutor) {
        this.config = config;
        this.restTemplate = restTemplate;
        this.reportExecutor = reportExecutor;
    }

    @Override
    public void onResult(MonitoringResult result) {
        try {
            reportExecutor.execute(() -> sendReport(result));
        } catch (TaskRejectedException e) {
            droppedCount.incrementAndGet();
            log.warn("Report queue full, dropping result for service {} at {}",
                    result.getServiceId(), result.getTimestamp());
        }
    }

    /**
     * Send one report synchronously, retrying transport failures.
     * Returns true once the master acknowledged it with a 2xx.
     */
    public boolean sendReport(MonitoringResult result) {
        String endpoint = config.masterEndpoint(FleetConstants.PATH_REPORT);
        HttpEntity<ReportRequest> entity = new HttpEntity<>(ReportRequest.of(result, config.getId()), headers());

        int attempts = Math.max(1, config.getReport().getRetryAttempts());
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                ResponseEntity<String> response = restTemplate.postForEntity(endpoint, entity, String.class);
                if (response.getStatusCode().is2xxSuccessful()) {
                    sentCount.incrementAndGet();
                    log.debug("Reported result for service {} (success={}, attempt {}/{})",
                            result.getServiceId(), result.isSuccess(), attempt, attempts);
                    return true;
                }
                log.warn("Report for service {} returned {} (attempt {}/{})",
                        result.getServiceId(), response.getStatusCode(), attempt, attempts);
            } catch (RestClientException e) {
                log.warn("Failed to send report for service {} (attempt {}/{}): {}",
                        result.getServiceId(), attempt, attempts, e.getMessage());
            }

            if (attempt < attempts) {
                try {
                    Thread.sleep(config.getReport().getRetryDelayMs() * attempt);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    log.warn("Report retry interrupted for service {}", result.getServiceId());
                    break;
                }
            }
        }

        failedCount.incrementAndGet();
        log.error("Giving up on report for service {} from slave {} (timestamp {})",
                result.getServiceId(), config.getId(), result.getTimestamp());
        return false;
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(HttpHeaders.AUTHORIZATION, ApiKeyValidator.bearer(config.getApiKey()));
        headers.set(FleetConstants.HEADER_SLAVE_ID, config.getId());
        return headers;
    }

    public long getSentCount() {
        return sentCount.get();
    }

    public long getFailedCount() {
        return failedCount.get();
    }

    public long getDroppedCount() {
        return droppedCount.get();
    }
}
