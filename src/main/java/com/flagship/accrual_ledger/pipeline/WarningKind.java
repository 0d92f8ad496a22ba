package com.flagship.accrual_ledger.pipeline;

/**
 * Non-fatal conditions collected during a run.
 */
public enum WarningKind {
    MALFORMED_ROW,
    DUPLICATE_ROW,
    UNKNOWN_CURRENCY,
    UNCLASSIFIABLE_EVENT,
    ORPHAN_REFUND,
    EXCESS_REVERSAL,
    NEGATIVE_ACCRUAL_CLEARING
}
