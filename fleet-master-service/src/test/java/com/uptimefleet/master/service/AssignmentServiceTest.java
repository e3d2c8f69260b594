package com.uptimefleet.master.service;

import com.uptimefleet.common.model.MonitorType;
import com.uptimefleet.common.model.ServiceConfig;
import com.uptimefleet.common.model.ServiceStatus;
import com.uptimefleet.common.model.SlaveStatus;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class AssignmentServiceTest {

    private SlaveStatus slave(String id) {
        return SlaveStatus.builder().id(id).host("localhost").port(3001).active(true).build();
    }

    private ServiceStatus assigned(String id, String... slaves) {
        ServiceStatus status = ServiceStatus.initial(ServiceConfig.builder().id(id).name(id)
                .type(MonitorType.ICMP).host("10.0.0.1").interval(30).timeout(1000).build(), 0L);
        status.getAssignedSlaves().addAll(List.of(slaves));
        return status;
    }

    @Test
    void testLeastLoadedSlaveIsChosen() {
        AssignmentService assignment = new AssignmentService(1, 100);
        Map<String, Integer> load = AssignmentService.loadBySlave(List.of(
                assigned("s1", "a"), assigned("s2", "a"), assigned("s3", "b")));

        assertEquals(List.of("c"), assignment.choose(List.of(slave("a"), slave("b"), slave("c")), load, Set.of(), 1));
        assertEquals(List.of("c", "b"), assignment.choose(List.of(slave("a"), slave("b"), slave("c")), load, Set.of(), 2));
    }

    @Test
    void testExcludedAndFullSlavesAreSkipped() {
        AssignmentService assignment = new AssignmentService(1, 2);
        Map<String, Integer> load = Map.of("a", 2, "b", 1);

        assertEquals(List.of(), assignment.choose(List.of(slave("a"), slave("b")), load, Set.of("b"), 1));
        assertEquals(List.of("b"), assignment.choose(List.of(slave("a"), slave("b")), load, Set.of(), 1));
    }

    @Test
    void testMissingReplicas() {
        AssignmentService assignment = new AssignmentService(2, 100);

        assertEquals(2, assignment.missingReplicas(assigned("s1")));
        assertEquals(1, assignment.missingReplicas(assigned("s1", "a")));
        assertEquals(0, assignment.missingReplicas(assigned("s1", "a", "b", "c")));
    }
}
