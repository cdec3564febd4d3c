package com.phoenixdash.gateway.recurring;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One execution attempt of a recurring payment. The id is the attempt id and
 * makes ledger commits replay-safe.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionRecord {
    private String id;
    private String recurringPaymentId;
    private ExecutionStatus status;
    private long amountSat;
    private String paymentId;
    private String paymentHash;
    private String errorMessage;
    private Instant executedAt;
}
