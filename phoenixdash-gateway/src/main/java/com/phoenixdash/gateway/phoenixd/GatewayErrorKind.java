package com.phoenixdash.gateway.phoenixd;

/**
 * Closed classification of payment gateway failures, decided at the client
 * boundary so callers switch on the kind instead of matching error text.
 */
public enum GatewayErrorKind {
    /** The node could not reach or resolve the recipient's Lightning Address domain. */
    ADDRESS_UNREACHABLE,
    /** The node accepted the request but the payment itself failed (routing, balance, ...). */
    PAYMENT_FAILED,
    /** The node answered with a non-2xx status. */
    NODE_REJECTED,
    /** The node itself could not be reached. */
    NODE_UNAVAILABLE,
    /** The call did not complete within its timeout. */
    TIMEOUT,
    /** The node answered 2xx with a body that is not a usable payment result. */
    INVALID_RESPONSE;

    /**
     * Whether a Lightning Address payment failing with this kind may be retried
     * through local LNURL-pay resolution.
     */
    public boolean allowsLnurlFallback() {
        return this == ADDRESS_UNREACHABLE;
    }
}
