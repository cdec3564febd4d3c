package com.phoenixdash.gateway.recurring;

/**
 * A schedule points at something that cannot be paid (missing or unsupported
 * address). Needs operator action rather than a retry.
 */
public class ScheduleConfigurationException extends RuntimeException {

    public ScheduleConfigurationException(String message) {
        super(message);
    }
}
