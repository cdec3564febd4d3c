package com.phoenixdash.gateway.recurring;

public class RecurringPaymentNotFoundException extends RuntimeException {

    private final String recurringPaymentId;

    public RecurringPaymentNotFoundException(String recurringPaymentId) {
        super("Recurring payment not found");
        this.recurringPaymentId = recurringPaymentId;
    }

    public String getRecurringPaymentId() {
        return recurringPaymentId;
    }
}
