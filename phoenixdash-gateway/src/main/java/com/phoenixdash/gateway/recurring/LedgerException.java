package com.phoenixdash.gateway.recurring;

/**
 * The recurring payment store could not be read or written.
 */
public class LedgerException extends RuntimeException {

    public LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
