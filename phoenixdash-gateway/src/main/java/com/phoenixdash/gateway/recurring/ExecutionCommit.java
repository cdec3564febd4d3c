package com.phoenixdash.gateway.recurring;

/**
 * Everything one execution writes, applied by the ledger as a single unit.
 *
 * @param metadata payment link to upsert, null when nothing was paid
 */
public record ExecutionCommit(ExecutionRecord record, ScheduleUpdate update, PaymentMetadata metadata) {
}
