package com.uptimefleet.slave.registry;

import com.uptimefleet.common.model.MonitorType;
import com.uptimefleet.common.model.ServiceConfig;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class ServiceRegistryTest {

    private ServiceConfig service(String id) {
        return ServiceConfig.builder().id(id).name(id).type(MonitorType.ICMP)
                .host("10.0.0.1").interval(30).timeout(1000).build();
    }

    @Test
    void testRegisterReturnsReplacedRegistration() {
        ServiceRegistry registry = new ServiceRegistry();
        ScheduleHandle first = () -> { };
        ScheduleHandle second = () -> { };

        assertFalse(registry.register(service("a"), first).isPresent());
        Optional<ServiceRegistry.Registration> replaced = registry.register(service("a"), second);

        assertTrue(replaced.isPresent());
        assertSame(first, replaced.get().getHandle());
        assertTrue(registry.isCurrent("a", second));
        assertFalse(registry.isCurrent("a", first));
        assertEquals(1, registry.size());
    }

    @Test
    void testRemoveForgetsTheService() {
        ServiceRegistry registry = new ServiceRegistry();
        ScheduleHandle handle = () -> { };
        registry.register(service("a"), handle);
        registry.register(service("b"), () -> { });

        assertTrue(registry.remove("a").isPresent());
        assertFalse(registry.remove("a").isPresent());
        assertFalse(registry.isCurrent("a", handle));
        assertEquals(1, registry.list().size());
        assertTrue(registry.serviceIds().contains("b"));
    }
}
