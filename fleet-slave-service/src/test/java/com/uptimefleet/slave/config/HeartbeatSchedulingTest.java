package com.uptimefleet.slave.config;

import com.sun.net.httpserver.HttpServer;
import com.uptimefleet.slave.reporter.HeartbeatSender;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Boots the slave against a fake master with a single check thread and a
 * one second heartbeat interval.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE, properties = {
        "fleet.slave.id=slave-test",
        "fleet.slave.api-key=test-key",
        "fleet.slave.max-concurrent-checks=1",
        "fleet.slave.heartbeat.interval-seconds=1"
})
public class HeartbeatSchedulingTest {

    private static final AtomicInteger heartbeats = new AtomicInteger();
    private static HttpServer master;

    @Autowired
    @Qualifier("checkTaskScheduler")
    private ThreadPoolTaskScheduler checkTaskScheduler;

    @Autowired
    @Qualifier("heartbeatTaskScheduler")
    private ThreadPoolTaskScheduler heartbeatTaskScheduler;

    @Autowired
    private HeartbeatSender heartbeatSender;

    @DynamicPropertySource
    static void masterProperties(DynamicPropertyRegistry registry) {
        try {
            master = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        master.createContext("/", exchange -> {
            if (exchange.getRequestURI().getPath().equals("/heartbeat")) {
                heartbeats.incrementAndGet();
            }
            byte[] body = "{\"status\":\"ok\"}".getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(200, body.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
        });
        master.setExecutor(Executors.newCachedThreadPool());
        master.start();
        registry.add("fleet.slave.master-url", () -> "http://127.0.0.1:" + master.getAddress().getPort());
    }

    @AfterAll
    static void stopMaster() {
        if (master != null) {
            master.stop(0);
        }
    }

    @Test
    void testSchedulersAreSeparatePools() {
        assertNotSame(checkTaskScheduler, heartbeatTaskScheduler);
        assertEquals(1, checkTaskScheduler.getPoolSize());
    }

    @Test
    void testHeartbeatKeepsFiringWhileChecksOccupyThePool() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        // a check that hangs on its only thread
        checkTaskScheduler.execute(() -> {
            started.countDown();
            try {
                release.await(15, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });

        try {
            assertTrue(started.await(2, TimeUnit.SECONDS));
            int before = heartbeats.get();
            int successesBefore = heartbeatSender.getStats().getSuccessCount();

            Thread.sleep(3_500);

            assertTrue(heartbeats.get() - before >= 2,
                    "expected heartbeats while the check pool was busy, got " + (heartbeats.get() - before));
            assertTrue(heartbeatSender.getStats().getSuccessCount() - successesBefore >= 2);
        } finally {
            release.countDown();
        }
    }
}
