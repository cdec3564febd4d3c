package com.phoenixdash.gateway.node;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * A configured phoenixd backend. Exactly one connection is active at a time.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class NodeConnection {
    private String id;
    private String name;
    private String url;
    @ToString.Exclude
    private String password;
    private boolean docker;
    private boolean active;
}
