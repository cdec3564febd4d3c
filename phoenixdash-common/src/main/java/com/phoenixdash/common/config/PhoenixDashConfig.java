package com.phoenixdash.common.config;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration type for the dashboard backend.
 */
@Data
public class PhoenixDashConfig {

    /** phoenixd node connections and client settings. */
    private PhoenixdConfig phoenixd;

    /** Recurring payment scheduler settings. */
    private RecurringConfig recurring;

    /** LNURL-pay fallback resolution settings. */
    private LnurlConfig lnurl;

    // --- Nested config types ---

    @Data
    public static class PhoenixdConfig {
        /** Used for the default Docker connection when none is configured. */
        private String defaultUrl = "http://phoenixd:9740";
        private String defaultPassword = "";
        /** Upper bound for a single phoenixd call, including payment settlement. */
        private int timeoutSeconds = 90;
        private int connectTimeoutSeconds = 10;
        private List<ConnectionConfig> connections = new ArrayList<>();
    }

    @Data
    public static class ConnectionConfig {
        private String id;
        private String name;
        private String url;
        private String password;
        private boolean docker;
        private boolean active;
    }

    @Data
    public static class RecurringConfig {
        private boolean enabled = true;
        private long intervalMs = 60_000;
        /** Pause between two due payments of the same tick. */
        private long itemDelayMs = 1_000;
        /** Publish an event for failed executions as well (off by default). */
        private boolean notifyOnFailure;
        /** Path of the recurring payment store; null = stateDir/recurring-store.json. */
        private String store;
    }

    @Data
    public static class LnurlConfig {
        private int timeoutSeconds = 20;
        /** Allow resolving Lightning Address domains to private addresses (tests, LAN setups). */
        private boolean allowPrivateNetwork;
        /** Scheme used for the well-known lookup; only changed in tests. */
        private String scheme = "https";
    }
}
