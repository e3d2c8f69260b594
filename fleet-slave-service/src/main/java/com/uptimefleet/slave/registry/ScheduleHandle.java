package com.uptimefleet.slave.registry;

/**
 * Cancellable schedule attached to a registered service
 */
public interface ScheduleHandle {

    /**
     * Stop future checks. A check already running may finish, but its result
     * must not be forwarded once this returns.
     */
    void cancel();
}
