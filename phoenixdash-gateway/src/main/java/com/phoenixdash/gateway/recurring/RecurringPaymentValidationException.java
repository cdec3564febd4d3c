package com.phoenixdash.gateway.recurring;

/**
 * A create or update request was rejected. The message is safe to show to the
 * dashboard user.
 */
public class RecurringPaymentValidationException extends RuntimeException {

    public RecurringPaymentValidationException(String message) {
        super(message);
    }
}
