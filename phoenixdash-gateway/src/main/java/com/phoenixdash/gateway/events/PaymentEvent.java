package com.phoenixdash.gateway.events;

/**
 * A payment notification as delivered to bus listeners.
 *
 * @param seq monotonic per bus
 * @param ts  epoch millis
 */
public record PaymentEvent(long seq, String type, long ts, Object payload) {

    public static final String RECURRING_PAYMENT_EXECUTED = "recurring_payment_executed";
    public static final String RECURRING_PAYMENT_FAILED = "recurring_payment_failed";
}
