package com.uptimefleet.master.state;

import com.uptimefleet.common.model.DowntimePeriod;
import com.uptimefleet.common.model.MonitoringResult;
import com.uptimefleet.common.model.ServiceConfig;
import com.uptimefleet.common.model.ServiceStatus;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Single writer of ServiceStatus.
 *
 * Every mutation goes through ConcurrentHashMap.compute on the service id, so
 * results for one service are applied one at a time while different services
 * proceed in parallel. A mutation works on a copy and swaps it in; readers
 * always get copies and never observe a half-applied result.
 */
@Slf4j
public class UptimeStateEngine {

    private final ConcurrentHashMap<String, ServiceStatus> statuses = new ConcurrentHashMap<>();

    /**
     * Create the status of a newly registered service: 100% uptime, no downtime
     */
    public ServiceStatus register(ServiceConfig config, long createdAt) {
        ServiceStatus status = ServiceStatus.initial(config, createdAt);
        statuses.put(config.getId(), status);
        log.info("Registered service {} ({}) at {}", config.getId(), config.getName(), createdAt);
        return status.copy();
    }

    public Optional<ServiceStatus> remove(String serviceId) {
        return Optional.ofNullable(statuses.remove(serviceId));
    }

    public Optional<ServiceStatus> apply(MonitoringResult result, long currentTime) {
        return apply(result, null, currentTime);
    }

    /**
     * Apply one result. Empty when the service is not registered (removed while
     * the check was in flight) or the result is stale or a duplicate.
     *
     * Staleness is judged against the newest timestamp seen from the same
     * slave, since slave clocks are not synchronized with each other. Without a
     * slave id the service-wide lastCheck is used.
     */
    public Optional<ServiceStatus> apply(MonitoringResult result, String slaveId, long currentTime) {
        ServiceStatus[] applied = new ServiceStatus[1];
        statuses.computeIfPresent(result.getServiceId(), (id, current) -> {
            if (isStaleOrDuplicate(current, result, slaveId)) {
                return current;
            }
            ServiceStatus next = current.copy();
            transition(next, result, currentTime);
            next.setLastCheck(result.getTimestamp());
            if (slaveId != null) {
                next.getLastCheckBySlave().put(slaveId, result.getTimestamp());
            }
            next.setLastStatus(result.isSuccess());
            recompute(next, currentTime);
            applied[0] = next;
            return next;
        });

        if (applied[0] == null) {
            if (!statuses.containsKey(result.getServiceId())) {
                log.debug("Dropping result for unregistered service {}", result.getServiceId());
            } else {
                log.debug("Dropping stale result for service {} (timestamp {})",
                        result.getServiceId(), result.getTimestamp());
            }
            return Optional.empty();
        }
        return Optional.of(applied[0].copy());
    }

    private static boolean isStaleOrDuplicate(ServiceStatus current, MonitoringResult result, String slaveId) {
        Long lastCheck = slaveId != null ? current.getLastCheckBySlave().get(slaveId) : current.getLastCheck();
        if (lastCheck == null) {
            return false;
        }
        if (result.getTimestamp() < lastCheck) {
            return true;
        }
        return result.getTimestamp() == lastCheck && result.isSuccess() == current.isLastStatus();
    }

    /**
     * Open a period on UP -> DOWN, close it on DOWN -> UP. The open period is
     * the source of truth, so there is never more than one.
     */
    private static void transition(ServiceStatus status, MonitoringResult result, long currentTime) {
        DowntimePeriod open = status.getOpenDowntime();
        if (!result.isSuccess() && open == null) {
            List<DowntimePeriod> periods = status.getDowntimePeriods();
            long start = currentTime;
            if (!periods.isEmpty()) {
                // keep periods ordered even if the clock stepped back
                DowntimePeriod previous = periods.get(periods.size() - 1);
                start = Math.max(start, previous.getEnd() != null ? previous.getEnd() : previous.getStart());
            }
            DowntimePeriod period = DowntimePeriod.open(start);
            periods.add(period);
            status.setLastDowntime(period);
            log.warn("Service {} ({}) is DOWN: {}", status.getId(), status.getName(), result.getError());
        } else if (result.isSuccess() && open != null) {
            open.setEnd(Math.max(currentTime, open.getStart()));
            log.info("Service {} ({}) is UP again after {} ms", status.getId(), status.getName(),
                    open.getEnd() - open.getStart());
        }
    }

    private static void recompute(ServiceStatus status, long currentTime) {
        status.setUptimePercentage(UptimeCalculator.lifetime(status, currentTime));
        status.setUptimePercentage30d(UptimeCalculator.rolling30d(status, currentTime));
    }

    public Optional<ServiceStatus> get(String serviceId) {
        ServiceStatus status = statuses.get(serviceId);
        return status == null ? Optional.empty() : Optional.of(status.copy());
    }

    public boolean contains(String serviceId) {
        return statuses.containsKey(serviceId);
    }

    public List<ServiceStatus> all() {
        return statuses.values().stream()
                .map(ServiceStatus::copy)
                .collect(Collectors.toList());
    }

    public int size() {
        return statuses.size();
    }

    /**
     * Load statuses from a snapshot, replacing whatever is in memory
     */
    public void restore(Collection<ServiceStatus> restored) {
        statuses.clear();
        for (ServiceStatus status : restored) {
            if (status == null || status.getId() == null) {
                continue;
            }
            statuses.put(status.getId(), status.copy().normalize());
        }
        log.info("Restored {} service statuses", statuses.size());
    }

    /**
     * Replace the assigned slave set of a service
     */
    public Optional<ServiceStatus> updateAssignment(String serviceId, UnaryOperator<Set<String>> update) {
        ServiceStatus updated = statuses.computeIfPresent(serviceId, (id, current) -> {
            ServiceStatus next = current.copy();
            next.setAssignedSlaves(update.apply(next.getAssignedSlaves()));
            next.getLastCheckBySlave().keySet().retainAll(next.getAssignedSlaves());
            return next;
        });
        return updated == null ? Optional.empty() : Optional.of(updated.copy());
    }

    /**
     * Drop closed periods that ended before cutoff, folding their length into
     * archivedDowntimeMs so the lifetime figure does not change.
     *
     * @return number of periods pruned
     */
    public int pruneRetention(long cutoff) {
        int pruned = 0;
        for (String serviceId : new ArrayList<>(statuses.keySet())) {
            int[] count = new int[1];
            statuses.computeIfPresent(serviceId, (id, current) -> {
                ServiceStatus next = current.copy();
                long archived = 0;
                Iterator<DowntimePeriod> it = next.getDowntimePeriods().iterator();
                while (it.hasNext()) {
                    DowntimePeriod period = it.next();
                    if (period.getEnd() != null && period.getEnd() < cutoff) {
                        archived += period.durationUntil(period.getEnd());
                        it.remove();
                        count[0]++;
                    }
                }
                if (count[0] == 0) {
                    return current;
                }
                next.setArchivedDowntimeMs(next.getArchivedDowntimeMs() + archived);
                return next;
            });
            if (count[0] > 0) {
                log.info("Pruned {} downtime periods of service {}", count[0], serviceId);
                pruned += count[0];
            }
        }
        return pruned;
    }
}
