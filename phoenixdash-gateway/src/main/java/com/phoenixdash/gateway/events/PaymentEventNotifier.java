package com.phoenixdash.gateway.events;

/**
 * Sink for payment notifications. Implementations must not throw back into
 * the payment path.
 */
@FunctionalInterface
public interface PaymentEventNotifier {

    void publish(String type, Object payload);

    PaymentEventNotifier NOOP = (type, payload) -> {
    };
}
