package com.phoenixdash.gateway.recurring;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum RecurringStatus {
    ACTIVE, PAUSED, CANCELLED;

    @JsonValue
    public String key() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static RecurringStatus fromKey(String key) {
        if (key == null)
            return null;
        for (RecurringStatus s : values()) {
            if (s.key().equals(key))
                return s;
        }
        return null;
    }
}
