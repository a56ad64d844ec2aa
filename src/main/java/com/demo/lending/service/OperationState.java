package com.demo.lending.service;

/**
 * Lifecycle of one ledger operation:
 * {@code PENDING -> VALIDATED -> (SUSPENDED) -> COMMITTED | REVERTED | REJECTED}.
 */
public enum OperationState {
    PENDING,
    VALIDATED,
    SUSPENDED,
    COMMITTED,
    REVERTED,
    REJECTED
}
