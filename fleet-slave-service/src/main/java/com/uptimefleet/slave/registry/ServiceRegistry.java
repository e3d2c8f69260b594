package com.uptimefleet.slave.registry;

import com.uptimefleet.common.model.ServiceConfig;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Services this slave currently monitors, keyed by service id, each with the
 * handle of its schedule.
 */
@Slf4j
public class ServiceRegistry {

    private final ConcurrentHashMap<String, Registration> services = new ConcurrentHashMap<>();

    /**
     * Register or replace a service; returns the replaced registration if any
     */
    public Optional<Registration> register(ServiceConfig config, ScheduleHandle handle) {
        Registration previous = services.put(config.getId(), new Registration(config, handle));
        if (previous != null) {
            log.info("Replaced registration for service {}", config.getId());
        }
        return Optional.ofNullable(previous);
    }

    public Optional<Registration> remove(String serviceId) {
        return Optional.ofNullable(services.remove(serviceId));
    }

    public Optional<ServiceConfig> get(String serviceId) {
        Registration registration = services.get(serviceId);
        return registration != null ? Optional.of(registration.getConfig()) : Optional.empty();
    }

    public boolean contains(String serviceId) {
        return services.containsKey(serviceId);
    }

    /**
     * True while this exact handle is the live registration for the id
     */
    public boolean isCurrent(String serviceId, ScheduleHandle handle) {
        Registration registration = services.get(serviceId);
        return registration != null && registration.getHandle() == handle;
    }

    public List<ServiceConfig> list() {
        List<ServiceConfig> configs = new ArrayList<>();
        services.values().forEach(r -> configs.add(r.getConfig()));
        return configs;
    }

    public Set<String> serviceIds() {
        return new LinkedHashSet<>(services.keySet());
    }

    public List<Registration> registrations() {
        return new ArrayList<>(services.values());
    }

    public int size() {
        return services.size();
    }

    public static final class Registration {
        private final ServiceConfig config;
        private final ScheduleHandle handle;

        Registration(ServiceConfig config, ScheduleHandle handle) {
            this.config = config;
            this.handle = handle;
        }

        public ServiceConfig getConfig() {
            return config;
        }

        public ScheduleHandle getHandle() {
            return handle;
        }
    }
}
