package com.demo.lending.service;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of a ledger operation. {@code ok} is true only when the operation committed;
 * a committed result may still carry a reason when a follow-up external call failed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationResult(
        boolean ok,
        String operation,
        OperationState state,
        FailureReason reason,
        String message
) {

    public static OperationResult committed(String operation, String message) {
        return new OperationResult(true, operation, OperationState.COMMITTED, null, message);
    }

    public static OperationResult committedWithWarning(String operation, FailureReason reason, String message) {
        return new OperationResult(true, operation, OperationState.COMMITTED, reason, message);
    }

    public static OperationResult reverted(String operation, FailureReason reason, String message) {
        return new OperationResult(false, operation, OperationState.REVERTED, reason, message);
    }

    public static OperationResult rejected(String operation, FailureReason reason, String message) {
        return new OperationResult(false, operation, OperationState.REJECTED, reason, message);
    }
}
