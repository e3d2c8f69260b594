package com.uptimefleet.slave.config;

import com.uptimefleet.slave.executor.CheckExecutor;
import com.uptimefleet.slave.probe.HttpProbe;
import com.uptimefleet.slave.probe.IcmpProbe;
import com.uptimefleet.slave.probe.Probe;
import com.uptimefleet.slave.registry.ServiceRegistry;
import com.uptimefleet.slave.reporter.HeartbeatSender;
import com.uptimefleet.slave.reporter.MasterReporter;
import com.uptimefleet.slave.scheduler.CheckScheduler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Wires the check pipeline: probes -> executor -> scheduler -> reporter
 */
@Slf4j
@Configuration
public class SlaveServiceConfig {

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, SlaveConfig config) {
        Duration timeout = Duration.ofMillis(config.getTransport().getTimeoutMs());
        return builder
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout)
                .build();
    }

    @Bean
    public HttpProbe httpProbe(SlaveConfig config) {
        return new HttpProbe(config.getCheckTimeoutMs());
    }

    @Bean
    public IcmpProbe icmpProbe() {
        return new IcmpProbe();
    }

    @Bean
    public CheckExecutor checkExecutor(List<Probe> probes, SlaveConfig config) {
        log.info("Check executor: {} probes, {} attempts, {}ms retry delay",
                probes.size(), config.getRetryAttempts(), config.getRetryDelayMs());
        return new CheckExecutor(probes, config.getCheckTimeoutMs(),
                config.getRetryAttempts(), config.getRetryDelayMs());
    }

    /**
     * Runs the per-service check timers only; its pool size bounds how many
     * checks run at the same time. @Scheduled work uses SchedulingConfig.
     */
    @Bean
    public ThreadPoolTaskScheduler checkTaskScheduler(SlaveConfig config) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(Math.max(1, config.getMaxConcurrentChecks()));
        scheduler.setThreadNamePrefix("check-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    @Bean
    public ServiceRegistry serviceRegistry() {
        return new ServiceRegistry();
    }

    @Bean
    public MasterReporter masterReporter(SlaveConfig config, RestTemplate restTemplate,
                                         @Qualifier("reportExecutor") Executor reportExecutor) {
        return new MasterReporter(config, restTemplate, reportExecutor);
    }

    @Bean
    public CheckScheduler checkScheduler(ServiceRegistry registry, CheckExecutor checkExecutor,
                                         @Qualifier("checkTaskScheduler") ThreadPoolTaskScheduler checkTaskScheduler,
                                         MasterReporter masterReporter) {
        return new CheckScheduler(registry, checkExecutor, checkTaskScheduler, masterReporter);
    }

    @Bean
    public HeartbeatSender heartbeatSender(SlaveConfig config, RestTemplate restTemplate,
                                           ServiceRegistry registry) {
        return new HeartbeatSender(config, restTemplate, registry);
    }
}
