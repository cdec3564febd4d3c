package com.phoenixdash.gateway.recurring;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of one execution, returned to the poller and to manual callers.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionResult(
        boolean success,
        String executionId,
        String paymentId,
        String paymentHash,
        Long amountSat,
        String error) {

    public static ExecutionResult succeeded(String executionId, String paymentId, String paymentHash,
            long amountSat) {
        return new ExecutionResult(true, executionId, paymentId, paymentHash, amountSat, null);
    }

    public static ExecutionResult failed(String executionId, String error) {
        return new ExecutionResult(false, executionId, null, null, null, error);
    }

    /** The executor was not invoked, so no execution record exists. */
    public static ExecutionResult rejected(String error) {
        return new ExecutionResult(false, null, null, null, null, error);
    }
}
