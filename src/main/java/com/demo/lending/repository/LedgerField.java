package com.demo.lending.repository;

/** Per-token position kept on an account. */
public enum LedgerField {
    BALANCE,
    COLLATERAL,
    BORROWED,
    /** Cumulative amount brought in through deposit; borrow proceeds and repayments never touch it. */
    DEPOSITED
}
