package com.phoenixdash.gateway.recurring;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Duration;

/**
 * Cadence of a recurring payment.
 */
public enum Frequency {
    EVERY_MINUTE("every_minute", Duration.ofMinutes(1)),
    EVERY_5_MINUTES("every_5_minutes", Duration.ofMinutes(5)),
    EVERY_15_MINUTES("every_15_minutes", Duration.ofMinutes(15)),
    EVERY_30_MINUTES("every_30_minutes", Duration.ofMinutes(30)),
    HOURLY("hourly", Duration.ofHours(1)),
    DAILY("daily", null),
    WEEKLY("weekly", null),
    MONTHLY("monthly", null);

    private final String key;
    private final Duration fixedInterval;

    Frequency(String key, Duration fixedInterval) {
        this.key = key;
        this.fixedInterval = fixedInterval;
    }

    @JsonValue
    public String key() {
        return key;
    }

    /** Interval for the minute/hour kinds; null for calendar-based kinds. */
    public Duration fixedInterval() {
        return fixedInterval;
    }

    /**
     * @return the frequency, or null if {@code key} is not a known cadence
     */
    @JsonCreator
    public static Frequency fromKey(String key) {
        if (key == null)
            return null;
        for (Frequency f : values()) {
            if (f.key.equals(key))
                return f;
        }
        return null;
    }
}
