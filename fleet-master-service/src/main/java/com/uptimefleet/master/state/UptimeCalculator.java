package com.uptimefleet.master.state;

import com.uptimefleet.common.model.DowntimePeriod;
import com.uptimefleet.common.model.ServiceStatus;

import java.util.concurrent.TimeUnit;

/**
 * Availability arithmetic over a service's downtime periods.
 * Both figures are clamped to [0, 100]; a service with no elapsed time is at 100.
 */
public final class UptimeCalculator {

    public static final long ROLLING_WINDOW_MS = TimeUnit.DAYS.toMillis(30);

    private UptimeCalculator() {
    }

    /**
     * 100 x (elapsed - downtime) / elapsed since createdAt, open periods counted up to currentTime
     */
    public static double lifetime(ServiceStatus status, long currentTime) {
        long elapsed = currentTime - status.getCreatedAt();
        if (elapsed <= 0) {
            return ServiceStatus.FULL_UPTIME;
        }
        long downtime = status.getArchivedDowntimeMs()
                + downtimeWithin(status, status.getCreatedAt(), currentTime);
        return percentage(elapsed, downtime);
    }

    /**
     * Same ratio over the last 30 days. Periods are clipped to the window and
     * the denominator is min(elapsed, 30d), so young services are not inflated.
     */
    public static double rolling30d(ServiceStatus status, long currentTime) {
        return rolling(status, currentTime, ROLLING_WINDOW_MS);
    }

    public static double rolling(ServiceStatus status, long currentTime, long windowMs) {
        long elapsed = currentTime - status.getCreatedAt();
        if (elapsed <= 0) {
            return ServiceStatus.FULL_UPTIME;
        }
        long span = Math.min(elapsed, windowMs);
        long windowStart = currentTime - span;
        return percentage(span, downtimeWithin(status, windowStart, currentTime));
    }

    static long downtimeWithin(ServiceStatus status, long from, long to) {
        long total = 0;
        for (DowntimePeriod period : status.getDowntimePeriods()) {
            total += overlap(period, from, to);
        }
        return total;
    }

    static long overlap(DowntimePeriod period, long from, long to) {
        long start = Math.max(period.getStart(), from);
        long end = Math.min(period.getEnd() != null ? period.getEnd() : to, to);
        return Math.max(0, end - start);
    }

    static double percentage(long span, long downtime) {
        double value = 100.0 * (span - downtime) / span;
        if (Double.isNaN(value)) {
            return ServiceStatus.FULL_UPTIME;
        }
        return Math.max(0.0, Math.min(ServiceStatus.FULL_UPTIME, value));
    }
}
