package com.phoenixdash.gateway.recurring;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of a contact payment address. Only Lightning Addresses and BOLT12
 * offers can be paid unattended.
 */
public enum AddressType {
    LIGHTNING_ADDRESS("lightning_address"),
    BOLT12_OFFER("bolt12_offer"),
    NODE_ID("node_id");

    private final String key;

    AddressType(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public boolean supportsRecurring() {
        return this == LIGHTNING_ADDRESS || this == BOLT12_OFFER;
    }

    @JsonCreator
    public static AddressType fromKey(String key) {
        for (AddressType t : values()) {
            if (t.key.equals(key))
                return t;
        }
        return null;
    }
}
