package com.uptimefleet.slave.probe;

import com.uptimefleet.common.constants.FleetConstants;
import com.uptimefleet.common.model.MonitorType;
import com.uptimefleet.common.model.ServiceConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;

import javax.net.ssl.SSLException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.ProtocolException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * HTTP GET probe. Any 2xx answer is a success.
 */
@Slf4j
public class HttpProbe implements Probe {

    private final HttpClient httpClient;

    public HttpProbe(long connectTimeoutMs) {
        this(HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(connectTimeoutMs))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
    }

    public HttpProbe(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public MonitorType type() {
        return MonitorType.HTTP;
    }

    @Override
    public ProbeResult probe(ServiceConfig config, long timeoutMs) {
        requireType(config);

        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(config.getUrl()))
                    .timeout(Duration.ofMillis(timeoutMs))
                    .header("User-Agent", FleetConstants.USER_AGENT)
                    .header("Accept", "application/json")
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            return ProbeResult.failure(ProbeErrorType.INVALID_TARGET, 0, "Invalid URL: " + config.getUrl());
        }

        long startNanos = System.nanoTime();
        try {
            HttpResponse<Void> response = httpClient.send(request, HttpResponse.BodyHandlers.discarding());
            long latencyMs = elapsedMs(startNanos);
            int status = response.statusCode();

            if (status >= 200 && status < 300) {
                return ProbeResult.success(latencyMs);
            }
            return ProbeResult.failure(ProbeErrorType.HTTP_STATUS, latencyMs,
                    "HTTP " + status + ": " + reasonPhrase(status));

        } catch (HttpTimeoutException e) {
            return ProbeResult.failure(ProbeErrorType.TIMEOUT, elapsedMs(startNanos), "Request timed out");
        } catch (IOException e) {
            return classifyIoFailure(e, elapsedMs(startNanos));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ProbeResult.failure(ProbeErrorType.UNKNOWN, elapsedMs(startNanos), "Check interrupted");
        }
    }

    private ProbeResult classifyIoFailure(IOException e, long latencyMs) {
        if (hasCause(e, SSLException.class)) {
            return ProbeResult.failure(ProbeErrorType.TLS_FAILURE, latencyMs, "TLS connection failed");
        }
        if (hasCause(e, ProtocolException.class)) {
            return ProbeResult.failure(ProbeErrorType.MALFORMED_RESPONSE, latencyMs,
                    "Malformed response: " + describe(e));
        }
        if (hasCause(e, ConnectException.class)) {
            return ProbeResult.failure(ProbeErrorType.CONNECTION_FAILED, latencyMs,
                    "Connection failed: " + describe(e));
        }
        return ProbeResult.failure(ProbeErrorType.CONNECTION_FAILED, latencyMs, describe(e));
    }

    static String reasonPhrase(int status) {
        HttpStatus resolved = HttpStatus.resolve(status);
        return resolved != null ? resolved.getReasonPhrase() : "Unknown Status";
    }

    private static boolean hasCause(Throwable t, Class<? extends Throwable> type) {
        Throwable current = t;
        while (current != null) {
            if (type.isInstance(current)) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }
}
