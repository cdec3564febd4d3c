package com.phoenixdash.gateway.recurring;

import java.time.Instant;

/**
 * Run-state change applied to a schedule after one execution.
 *
 * @param nextRunAt  new due time, null leaves it unchanged
 * @param lastRunAt  null leaves it unchanged
 * @param lastError  written as is; null clears it
 * @param paidDelta  added to totalPaid
 * @param countDelta added to paymentCount
 */
public record ScheduleUpdate(Instant nextRunAt, Instant lastRunAt, String lastError, long paidDelta,
        int countDelta) {

    public static ScheduleUpdate succeeded(Instant now, Instant nextRunAt, long amountSat) {
        return new ScheduleUpdate(nextRunAt, now, null, amountSat, 1);
    }

    public static ScheduleUpdate failed(String error, Instant nextRunAt) {
        return new ScheduleUpdate(nextRunAt, null, error, 0, 0);
    }

    /** Misconfigured schedule: record the error, keep nextRunAt. */
    public static ScheduleUpdate misconfigured(String error) {
        return new ScheduleUpdate(null, null, error, 0, 0);
    }
}
