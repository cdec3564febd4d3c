package com.phoenixdash.gateway.recurring;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory advisory locks keyed by schedule id. Only guards executions inside
 * this process.
 */
public class ScheduleLocks {

    private final Set<String> held = ConcurrentHashMap.newKeySet();

    /**
     * @return false if the schedule is already being executed
     */
    public boolean tryAcquire(String scheduleId) {
        return held.add(scheduleId);
    }

    public void release(String scheduleId) {
        held.remove(scheduleId);
    }

    public boolean isHeld(String scheduleId) {
        return held.contains(scheduleId);
    }
}
