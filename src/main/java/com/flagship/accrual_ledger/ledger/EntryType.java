package com.flagship.accrual_ledger.ledger;

/**
 * Represents the side of a split in double-entry accounting.
 * Positive signed amounts are debits, negative ones credits.
 */
public enum EntryType {
    DEBIT,
    CREDIT
}
