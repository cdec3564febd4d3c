package com.phoenixdash.gateway.recurring;

/**
 * A schedule loaded together with its contact, ready for execution.
 *
 * @param contact null when the contact has been deleted
 */
public record DuePayment(RecurringPayment schedule, Contact contact) {
}
