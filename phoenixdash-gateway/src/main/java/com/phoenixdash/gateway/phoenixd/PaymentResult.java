package com.phoenixdash.gateway.phoenixd;

/**
 * Settlement details of an outgoing payment.
 */
public record PaymentResult(
        String paymentId,
        String paymentHash,
        long recipientAmountSat,
        long routingFeeSat,
        String paymentPreimage) {
}
