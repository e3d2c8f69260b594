package com.uptimefleet.master.state;

import com.uptimefleet.common.model.DowntimePeriod;
import com.uptimefleet.common.model.MonitorType;
import com.uptimefleet.common.model.MonitoringResult;
import com.uptimefleet.common.model.ServiceConfig;
import com.uptimefleet.common.model.ServiceStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class UptimeStateEngineTest {

    private static final long T0 = 1_700_000_000_000L;

    private UptimeStateEngine engine;

    @BeforeEach
    void setUp() {
        engine = new UptimeStateEngine();
        engine.register(config("svc-1"), T0);
    }

    private ServiceConfig config(String id) {
        return ServiceConfig.builder()
                .id(id).name("Service " + id).type(MonitorType.HTTP)
                .url("http://example.com/" + id).interval(10).timeout(1000)
                .build();
    }

    private ServiceStatus apply(boolean success, long at) {
        MonitoringResult result = success
                ? MonitoringResult.up("svc-1", at, 5)
                : MonitoringResult.down("svc-1", at, 5, "HTTP 500: Internal Server Error");
        return engine.apply(result, at).orElse(null);
    }

    @Test
    void testOutageOfThirtySecondsInHundredIsSeventyPercent() {
        apply(false, T0 + 10_000);
        apply(true, T0 + 40_000);
        ServiceStatus status = apply(true, T0 + 100_000);

        assertEquals(70.0, status.getUptimePercentage(), 1e-9);
        assertEquals(70.0, status.getUptimePercentage30d(), 1e-9);
        assertEquals(1, status.getDowntimePeriods().size());
        assertEquals(new DowntimePeriod(T0 + 10_000, T0 + 40_000L), status.getDowntimePeriods().get(0));
        assertEquals(status.getDowntimePeriods().get(0), status.getLastDowntime());
        assertTrue(status.isLastStatus());
        assertEquals(T0 + 100_000, status.getLastCheck());
    }

    @Test
    void testFirstSuccessOpensNoPeriod() {
        ServiceStatus status = apply(true, T0 + 1_000);

        assertTrue(status.getDowntimePeriods().isEmpty());
        assertNull(status.getLastDowntime());
        assertEquals(100.0, status.getUptimePercentage());
    }

    @Test
    void testFirstFailureOpensPeriod() {
        ServiceStatus status = apply(false, T0 + 1_000);

        assertEquals(1, status.getDowntimePeriods().size());
        assertTrue(status.getOpenDowntime() != null);
        assertFalse(status.isLastStatus());
    }

    @Test
    void testRepeatedFailuresKeepOneOpenPeriod() {
        apply(false, T0 + 1_000);
        apply(false, T0 + 2_000);
        ServiceStatus status = apply(false, T0 + 3_000);

        assertEquals(1, status.getDowntimePeriods().size());
        assertEquals(T0 + 1_000, status.getOpenDowntime().getStart());
        assertEquals(T0 + 3_000, status.getLastCheck());
    }

    @Test
    void testDuplicateResultIsIdempotent() {
        apply(false, T0 + 1_000);
        MonitoringResult recovery = MonitoringResult.up("svc-1", T0 + 5_000, 5);

        assertTrue(engine.apply(recovery, T0 + 5_000).isPresent());
        assertFalse(engine.apply(recovery, T0 + 5_500).isPresent());

        ServiceStatus status = engine.get("svc-1").orElseThrow();
        assertEquals(1, status.getDowntimePeriods().size());
        assertEquals(T0 + 5_000, status.getDowntimePeriods().get(0).getEnd());
    }

    @Test
    void testStaleResultIsIgnored() {
        apply(true, T0 + 5_000);

        assertFalse(engine.apply(MonitoringResult.down("svc-1", T0 + 4_000, 5, "late"), T0 + 6_000).isPresent());
        assertTrue(engine.get("svc-1").orElseThrow().isLastStatus());
    }

    @Test
    void testStaleGuardIsTrackedPerSlave() {
        assertTrue(engine.apply(MonitoringResult.down("svc-1", T0 + 10_000, 5, "down"), "slave-a", T0 + 10_000)
                .isPresent());
        // slave-b's clock runs behind slave-a's
        assertTrue(engine.apply(MonitoringResult.up("svc-1", T0 + 2_000, 5), "slave-b", T0 + 20_000).isPresent());

        assertFalse(engine.apply(MonitoringResult.down("svc-1", T0 + 1_000, 5, "late"), "slave-b", T0 + 21_000)
                .isPresent());
        assertFalse(engine.apply(MonitoringResult.down("svc-1", T0 + 9_000, 5, "late"), "slave-a", T0 + 22_000)
                .isPresent());

        ServiceStatus status = engine.get("svc-1").orElseThrow();
        assertTrue(status.isLastStatus());
        assertEquals(new DowntimePeriod(T0 + 10_000, T0 + 20_000L), status.getDowntimePeriods().get(0));
        assertEquals(T0 + 2_000, status.getLastCheckBySlave().get("slave-b"));
    }

    @Test
    void testReassignmentForgetsRemovedSlaveTimestamps() {
        engine.updateAssignment("svc-1", slaves -> {
            slaves.add("slave-a");
            return slaves;
        });
        engine.apply(MonitoringResult.up("svc-1", T0 + 1_000, 5), "slave-a", T0 + 1_000);

        engine.updateAssignment("svc-1", slaves -> {
            slaves.remove("slave-a");
            slaves.add("slave-b");
            return slaves;
        });

        assertFalse(engine.get("svc-1").orElseThrow().getLastCheckBySlave().containsKey("slave-a"));
    }

    @Test
    void testResultForUnknownServiceIsDropped() {
        assertFalse(engine.apply(MonitoringResult.down("nope", T0, 1, "x"), T0).isPresent());

        engine.remove("svc-1");
        assertFalse(engine.apply(MonitoringResult.down("svc-1", T0 + 1, 1, "x"), T0 + 1).isPresent());
        assertEquals(0, engine.size());
    }

    @Test
    void testZeroElapsedTimeStaysInBounds() {
        ServiceStatus status = engine.apply(MonitoringResult.down("svc-1", T0, 1, "down"), T0).orElseThrow();

        assertEquals(100.0, status.getUptimePercentage());
        assertEquals(100.0, status.getUptimePercentage30d());
    }

    @Test
    void testRandomSequencesKeepInvariants() {
        Random random = new Random(42);
        for (int run = 0; run < 20; run++) {
            String id = "rnd-" + run;
            engine.register(config(id), T0);
            long now = T0;
            for (int i = 0; i < 200; i++) {
                now += random.nextInt(120_000);
                MonitoringResult result = random.nextBoolean()
                        ? MonitoringResult.up(id, now, 1)
                        : MonitoringResult.down(id, now, 1, "down");
                // occasionally replay an old result
                if (random.nextInt(10) == 0) {
                    engine.apply(MonitoringResult.up(id, now - 50_000, 1), now);
                }
                engine.apply(result, now);

                ServiceStatus status = engine.get(id).orElseThrow();
                assertInvariants(status);
            }
        }
    }

    private static void assertInvariants(ServiceStatus status) {
        List<DowntimePeriod> periods = status.getDowntimePeriods();
        int open = 0;
        for (int i = 0; i < periods.size(); i++) {
            if (periods.get(i).isOpen()) {
                open++;
                assertEquals(periods.size() - 1, i, "only the last period may be open");
            }
            if (i > 0) {
                assertTrue(periods.get(i).getStart() >= periods.get(i - 1).getStart());
            }
        }
        assertTrue(open <= 1);
        assertTrue(status.getUptimePercentage() >= 0 && status.getUptimePercentage() <= 100);
        assertTrue(status.getUptimePercentage30d() >= 0 && status.getUptimePercentage30d() <= 100);
    }

    @Test
    void testConcurrentResultsForOneServiceAreSerialized() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        for (int i = 1; i <= 400; i++) {
            long at = T0 + i * 1_000L;
            boolean success = i % 3 != 0;
            pool.submit(() -> {
                start.await();
                engine.apply(success ? MonitoringResult.up("svc-1", at, 1)
                        : MonitoringResult.down("svc-1", at, 1, "down"), at);
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

        assertInvariants(engine.get("svc-1").orElseThrow());
    }

    @Test
    void testPruneRetentionKeepsLifetimeFigure() {
        long day = TimeUnit.DAYS.toMillis(1);
        apply(false, T0 + day);
        apply(true, T0 + 2 * day);
        apply(false, T0 + 50 * day);
        apply(true, T0 + 51 * day);
        ServiceStatus before = apply(true, T0 + 60 * day);

        int pruned = engine.pruneRetention(T0 + 30 * day);
        ServiceStatus after = engine.get("svc-1").orElseThrow();

        assertEquals(1, pruned);
        assertEquals(1, after.getDowntimePeriods().size());
        assertEquals(day, after.getArchivedDowntimeMs());
        assertEquals(before.getUptimePercentage(),
                UptimeCalculator.lifetime(after, T0 + 60 * day), 1e-9);
    }

    @Test
    void testOpenPeriodIsNeverPruned() {
        apply(false, T0 + 1_000);
        assertEquals(0, engine.pruneRetention(T0 + 1_000_000_000L));
        assertNotNull(engine.get("svc-1").orElseThrow().getOpenDowntime());
    }

    @Test
    void testReadersGetCopies() {
        apply(false, T0 + 1_000);
        ServiceStatus copy = engine.get("svc-1").orElseThrow();
        copy.getDowntimePeriods().clear();
        copy.getAssignedSlaves().add("intruder");

        ServiceStatus fresh = engine.get("svc-1").orElseThrow();
        assertEquals(1, fresh.getDowntimePeriods().size());
        assertTrue(fresh.getAssignedSlaves().isEmpty());
    }

    @Test
    void testUpdateAssignmentAndRestore() {
        engine.updateAssignment("svc-1", slaves -> {
            slaves.add("slave-a");
            return slaves;
        });
        List<ServiceStatus> saved = new ArrayList<>(engine.all());

        UptimeStateEngine restored = new UptimeStateEngine();
        restored.restore(saved);

        Set<String> expected = new LinkedHashSet<>();
        expected.add("slave-a");
        assertEquals(expected, restored.get("svc-1").orElseThrow().getAssignedSlaves());
        assertFalse(engine.updateAssignment("missing", s -> s).isPresent());
    }
}
