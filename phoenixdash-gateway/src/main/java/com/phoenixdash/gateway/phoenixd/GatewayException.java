package com.phoenixdash.gateway.phoenixd;

/**
 * A failed call to the payment gateway. Always retried on the schedule's
 * normal cadence.
 */
public class GatewayException extends RuntimeException {

    private final GatewayErrorKind kind;

    public GatewayException(GatewayErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public GatewayException(GatewayErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public GatewayErrorKind getKind() {
        return kind;
    }
}
