package com.phoenixdash.gateway.recurring;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ExecutionStatus {
    SUCCESS, FAILED;

    @JsonValue
    public String key() {
        return name().toLowerCase();
    }
}
