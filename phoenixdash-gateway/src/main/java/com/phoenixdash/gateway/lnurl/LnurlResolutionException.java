package com.phoenixdash.gateway.lnurl;

/**
 * LNURL-pay resolution failed. Handled exactly like a gateway failure.
 */
public class LnurlResolutionException extends RuntimeException {

    public LnurlResolutionException(String message) {
        super(message);
    }

    public LnurlResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
