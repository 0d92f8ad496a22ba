package com.flagship.accrual_ledger.classify;

/**
 * Accounting event type assigned by the classifier.
 */
public enum EventType {
    CHARGE,
    REFUND,
    PAYOUT,
    FEE,
    ADJUSTMENT,
    DISPUTE;

    public boolean isReversal() {
        return this == REFUND || this == ADJUSTMENT || this == DISPUTE;
    }
}
