package com.phoenixdash.gateway.phoenixd;

import com.phoenixdash.gateway.node.NodeConnection;

/**
 * Binds a gateway client to one node connection.
 */
@FunctionalInterface
public interface PaymentGatewayFactory {
    PaymentGateway forConnection(NodeConnection connection);
}
