package com.uptimefleet.master.config;

import com.uptimefleet.common.security.ApiKeyValidator;
import com.uptimefleet.master.client.SlaveClient;
import com.uptimefleet.master.registry.SlaveRegistry;
import com.uptimefleet.master.service.AssignmentService;
import com.uptimefleet.master.service.MonitoringService;
import com.uptimefleet.master.state.UptimeStateEngine;
import com.uptimefleet.master.storage.DurableStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.client.RestTemplate;

import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;

/**
 * Master component wiring
 */
@Slf4j
@Configuration
public class MasterServiceConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, MasterConfig config) {
        Duration timeout = Duration.ofMillis(config.getSlaveClient().getTimeoutMs());
        return builder
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout)
                .build();
    }

    /**
     * Runs debounced saves and the @Scheduled maintenance jobs
     */
    @Bean
    public ThreadPoolTaskScheduler masterTaskScheduler(Clock clock) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(4);
        scheduler.setThreadNamePrefix("master-");
        scheduler.setClock(clock);
        return scheduler;
    }

    @Bean
    public ApiKeyValidator apiKeyValidator(MasterConfig config) {
        return new ApiKeyValidator(config.getApiKey());
    }

    @Bean
    public DurableStore durableStore(MasterConfig config, ThreadPoolTaskScheduler masterTaskScheduler, Clock clock) {
        return new DurableStore(Paths.get(config.getDataDir(), config.getStorage().getFileName()),
                config.getStorage().getSaveDebounceMs(), masterTaskScheduler, clock);
    }

    @Bean
    public UptimeStateEngine uptimeStateEngine() {
        return new UptimeStateEngine();
    }

    @Bean
    public SlaveRegistry slaveRegistry(MasterConfig config) {
        return new SlaveRegistry(config.heartbeatTimeoutMs());
    }

    @Bean
    public SlaveClient slaveClient(RestTemplate restTemplate, MasterConfig config) {
        return new SlaveClient(restTemplate, config.getApiKey());
    }

    @Bean
    public AssignmentService assignmentService(MasterConfig config) {
        return new AssignmentService(config.getAssignment().getReplicas(),
                config.getAssignment().getMaxServicesPerSlave());
    }

    @Bean
    public MonitoringService monitoringService(UptimeStateEngine engine, SlaveRegistry slaveRegistry,
                                               DurableStore durableStore, SlaveClient slaveClient,
                                               AssignmentService assignmentService, Clock clock,
                                               MasterConfig config) {
        return new MonitoringService(engine, slaveRegistry, durableStore, slaveClient,
                assignmentService, clock, config.effectiveRetentionDays());
    }
}
