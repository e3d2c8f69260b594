package com.uptimefleet.slave.scheduler;

import com.uptimefleet.common.model.MonitoringResult;
import com.uptimefleet.common.model.ServiceConfig;
import com.uptimefleet.slave.executor.CheckExecutor;
import com.uptimefleet.slave.registry.ScheduleHandle;
import com.uptimefleet.slave.registry.ServiceRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;

import javax.annotation.PreDestroy;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * Runs every registered service on its own timer.
 *
 * The first check fires as soon as the service is registered. The next one is
 * only scheduled after the current check settled, at the later of
 * (previous fire time + interval) and now, so an overrunning check delays
 * the next tick instead of stacking ticks, and one service never runs two
 * checks at once.
 */
@Slf4j
public class CheckScheduler {

    private final ServiceRegistry registry;
    private final CheckExecutor checkExecutor;
    private final TaskScheduler taskScheduler;
    private final ResultListener resultListener;

    public CheckScheduler(ServiceRegistry registry, CheckExecutor checkExecutor,
                          TaskScheduler taskScheduler, ResultListener resultListener) {
        this.registry = registry;
        this.checkExecutor = checkExecutor;
        this.taskScheduler = taskScheduler;
        this.resultListener = resultListener;
    }

    /**
     * Register a service (replacing any schedule with the same id) and start
     * checking it immediately
     */
    public void schedule(ServiceConfig config) {
        ScheduledCheck check = new ScheduledCheck(config);
        registry.register(config, check)
                .ifPresent(previous -> previous.getHandle().cancel());
        check.start();
        log.info("Scheduled service {} ({}) every {}s, timeout {} ms",
                config.getName(), config.getId(), config.getInterval(), config.getTimeout());
    }

    /**
     * Deregister a service and cancel its timer. Returns false if it was unknown.
     */
    public boolean unschedule(String serviceId) {
        return registry.remove(serviceId)
                .map(registration -> {
                    registration.getHandle().cancel();
                    log.info("Unscheduled service {}", serviceId);
                    return true;
                })
                .orElse(false);
    }

    @PreDestroy
    public void cancelAll() {
        registry.registrations().forEach(registration -> registration.getHandle().cancel());
        log.info("Cancelled {} scheduled checks", registry.size());
    }

    /**
     * Self-rescheduling timer of one service
     */
    final class ScheduledCheck implements ScheduleHandle, Runnable {

        private final ServiceConfig config;
        private final Object lock = new Object();

        // guarded by lock
        private boolean cancelled;
        private ScheduledFuture<?> future;
        private long nextFireAt;

        ScheduledCheck(ServiceConfig config) {
            this.config = config;
        }

        void start() {
            synchronized (lock) {
                if (cancelled) {
                    return;
                }
                nextFireAt = System.currentTimeMillis();
                future = taskScheduler.schedule(this, Instant.ofEpochMilli(nextFireAt));
            }
        }

        @Override
        public void run() {
            synchronized (lock) {
                if (cancelled) {
                    return;
                }
            }

            MonitoringResult result;
            try {
                result = checkExecutor.execute(config);
            } catch (RuntimeException e) {
                log.error("Check for service {} failed unexpectedly", config.getId(), e);
                result = MonitoringResult.down(config.getId(), System.currentTimeMillis(), 0, e.toString());
            }

            synchronized (lock) {
                if (cancelled || !registry.isCurrent(config.getId(), this)) {
                    log.debug("Dropping result for removed service {}", config.getId());
                    return;
                }
                try {
                    resultListener.onResult(result);
                } catch (RuntimeException e) {
                    log.error("Result listener failed for service {}: {}", config.getId(), e.getMessage());
                }
                nextFireAt = Math.max(nextFireAt + config.getIntervalMs(), System.currentTimeMillis());
                try {
                    future = taskScheduler.schedule(this, Instant.ofEpochMilli(nextFireAt));
                } catch (TaskRejectedException e) {
                    log.warn("Could not reschedule service {}, scheduler is shutting down", config.getId());
                }
            }
        }

        @Override
        public void cancel() {
            synchronized (lock) {
                cancelled = true;
                if (future != null) {
                    future.cancel(false);
                }
            }
        }
    }
}
