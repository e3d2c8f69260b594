package com.uptimefleet.common.model;

import com.uptimefleet.common.util.JsonUtils;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ServiceStatusTest {

    private ServiceConfig config() {
        return ServiceConfig.builder()
                .id("svc-1").name("Website").type(MonitorType.HTTP)
                .url("https://example.com").interval(60).timeout(5000)
                .build();
    }

    @Test
    void testInitialStatusIsFullyUp() {
        ServiceStatus status = ServiceStatus.initial(config(), 1000L);

        assertEquals("svc-1", status.getId());
        assertEquals(1000L, status.getCreatedAt());
        assertNull(status.getLastCheck());
        assertTrue(status.isLastStatus());
        assertEquals(100.0, status.getUptimePercentage());
        assertEquals(100.0, status.getUptimePercentage30d());
        assertTrue(status.getDowntimePeriods().isEmpty());
        assertTrue(status.getAssignedSlaves().isEmpty());
        assertNull(status.getOpenDowntime());
    }

    @Test
    void testCopyIsIndependentAndKeepsLastDowntimeLinked() {
        ServiceStatus status = ServiceStatus.initial(config(), 0L);
        DowntimePeriod period = DowntimePeriod.open(10L);
        status.getDowntimePeriods().add(period);
        status.setLastDowntime(period);
        status.getAssignedSlaves().add("slave-a");

        ServiceStatus copy = status.copy();
        copy.getOpenDowntime().setEnd(20L);
        copy.getAssignedSlaves().add("slave-b");

        // original untouched
        assertNull(period.getEnd());
        assertEquals(1, status.getAssignedSlaves().size());
        // the copy's lastDowntime is the copy's period
        assertSame(copy.getDowntimePeriods().get(0), copy.getLastDowntime());
        assertEquals(20L, copy.getLastDowntime().getEnd());
    }

    @Test
    void testNormalizeRepairsNullElementsAndExtraOpenPeriods() {
        ServiceStatus status = JsonUtils.fromJson("{\"id\":\"svc-1\",\"createdAt\":1,"
                + "\"assignedSlaves\":[null],\"lastCheckBySlave\":null,"
                + "\"downtimePeriods\":[{\"start\":30},null,{\"start\":10}]}", ServiceStatus.class);

        ServiceStatus copy = status.copy();
        assertEquals(2, copy.getDowntimePeriods().size());

        status.normalize();

        assertTrue(status.getAssignedSlaves().isEmpty());
        assertNotNull(status.getLastCheckBySlave());
        assertEquals(2, status.getDowntimePeriods().size());
        // only the latest period stays open
        assertEquals(30L, status.getDowntimePeriods().get(0).getEnd());
        assertEquals(30L, status.getOpenDowntime().getStart());
    }

    @Test
    void testMissingFieldsFallBackToDefaults() {
        ServiceStatus status = JsonUtils.fromJson("{\"id\":\"svc-1\",\"createdAt\":5}", ServiceStatus.class);

        assertEquals("svc-1", status.getId());
        assertTrue(status.isLastStatus());
        assertEquals(100.0, status.getUptimePercentage());
        assertEquals(100.0, status.getUptimePercentage30d());
        assertNotNull(status.getDowntimePeriods());
        assertNotNull(status.getAssignedSlaves());
    }

    @Test
    void testTypeSerializesAsLowercaseValue() {
        String json = JsonUtils.toJson(ServiceStatus.initial(config(), 0L));
        assertTrue(json.contains("\"type\" : \"http\""), json);
        assertEquals(MonitorType.ICMP, MonitorType.fromValue("ICMP"));
    }

    @Test
    void testDowntimeDurationCountsOpenPeriodUpToNow() {
        assertEquals(30L, new DowntimePeriod(10L, 40L).durationUntil(100L));
        assertEquals(90L, DowntimePeriod.open(10L).durationUntil(100L));
        assertEquals(0L, DowntimePeriod.open(10L).durationUntil(5L));
    }
}
