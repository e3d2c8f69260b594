package com.uptimefleet.slave.probe;

import com.sun.net.httpserver.HttpServer;
import com.uptimefleet.common.exception.ErrorCode;
import com.uptimefleet.common.exception.FleetException;
import com.uptimefleet.common.model.MonitorType;
import com.uptimefleet.common.model.MonitoringResult;
import com.uptimefleet.common.model.ServiceConfig;
import com.uptimefleet.slave.executor.CheckExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the HTTP probe against a throwaway local server
 */
public class HttpProbeTest {

    private HttpServer server;
    private String baseUrl;
    private final AtomicInteger failHits = new AtomicInteger();
    private final AtomicReference<String> userAgent = new AtomicReference<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/ok", exchange -> {
            userAgent.set(exchange.getRequestHeaders().getFirst("User-Agent"));
            respond(exchange, 200, "{\"status\":\"ok\"}");
        });
        server.createContext("/created", exchange -> respond(exchange, 204, null));
        server.createContext("/fail", exchange -> {
            failHits.incrementAndGet();
            respond(exchange, 500, "error");
        });
        server.createContext("/slow", exchange -> {
            try {
                Thread.sleep(2000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            respond(exchange, 200, "late");
        });
        server.setExecutor(Executors.newCachedThreadPool());
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private static void respond(com.sun.net.httpserver.HttpExchange exchange, int status, String body)
            throws IOException {
        if (body == null) {
            exchange.sendResponseHeaders(status, -1);
            exchange.close();
            return;
        }
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private ServiceConfig service(String url, long timeout) {
        return ServiceConfig.builder()
                .id("svc-http").name("Local").type(MonitorType.HTTP)
                .url(url).interval(60).timeout(timeout)
                .build();
    }

    @Test
    void testSuccessfulResponseIsUp() {
        ProbeResult result = new HttpProbe(2000).probe(service(baseUrl + "/ok", 2000), 2000);

        assertTrue(result.isSuccess());
        assertTrue(result.getLatencyMs() >= 0);
        assertEquals("UptimeFleet-Monitor/1.0", userAgent.get());
    }

    @Test
    void testAny2xxIsUp() {
        assertTrue(new HttpProbe(2000).probe(service(baseUrl + "/created", 2000), 2000).isSuccess());
    }

    @Test
    void testServerErrorIsReportedWithStatusAndReason() {
        ProbeResult result = new HttpProbe(2000).probe(service(baseUrl + "/fail", 2000), 2000);

        assertFalse(result.isSuccess());
        assertEquals(ProbeErrorType.HTTP_STATUS, result.getErrorType());
        assertEquals("HTTP 500: Internal Server Error", result.getMessage());
    }

    @Test
    void testSlowResponseTimesOut() {
        ProbeResult result = new HttpProbe(2000).probe(service(baseUrl + "/slow", 300), 300);

        assertFalse(result.isSuccess());
        assertEquals(ProbeErrorType.TIMEOUT, result.getErrorType());
        assertEquals("Request timed out", result.getMessage());
    }

    @Test
    void testClosedPortIsConnectionFailure() throws IOException {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        ProbeResult result = new HttpProbe(1000).probe(service("http://127.0.0.1:" + port + "/", 1000), 1000);

        assertFalse(result.isSuccess());
        assertEquals(ProbeErrorType.CONNECTION_FAILED, result.getErrorType());
    }

    @Test
    void testIcmpConfigIsRejected() {
        ServiceConfig icmp = ServiceConfig.builder().id("svc-icmp").name("Gateway")
                .type(MonitorType.ICMP).host("127.0.0.1").interval(60).timeout(1000).build();

        FleetException e = assertThrows(FleetException.class, () -> new HttpProbe(1000).probe(icmp, 1000));
        assertEquals(ErrorCode.PROBE_TYPE_MISMATCH, e.getErrorCode());
    }

    @Test
    void testUnknownStatusReason() {
        assertEquals("Unknown Status", HttpProbe.reasonPhrase(599));
        assertEquals("Not Found", HttpProbe.reasonPhrase(404));
    }

    @Test
    void testPersistentServerErrorIsRetriedThreeTimes() {
        CheckExecutor executor = new CheckExecutor(List.of(new HttpProbe(2000)), 30000, 3, 1000);

        long start = System.currentTimeMillis();
        MonitoringResult result = executor.execute(service(baseUrl + "/fail", 2000));
        long elapsed = System.currentTimeMillis() - start;

        assertFalse(result.isSuccess());
        assertTrue(result.getError().startsWith("HTTP 500: "), result.getError());
        assertEquals(3, failHits.get());
        assertTrue(elapsed >= 2000, "elapsed " + elapsed);
        assertTrue(result.getDuration() < 1000, "duration excludes retry waits: " + result.getDuration());
    }
}
