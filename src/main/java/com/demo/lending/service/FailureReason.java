package com.demo.lending.service;

public enum FailureReason {
    /** Collateral or balance rule, duplicate signup, bad amount. State untouched. */
    POLICY_VIOLATION,
    /** Risk service returned high risk; the tentative change was undone. */
    HIGH_RISK,
    /** Token ledger call failed. */
    EXTERNAL_CALL_FAILURE,
    /** Unknown user or unsupported token. */
    NOT_FOUND
}
