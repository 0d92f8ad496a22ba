package com.flagship.accrual_ledger.exception;

/**
 * Base type for every failure the ledger engine reports.
 *
 * Each subtype carries its own scope (row, event, transaction, run) and the
 * pipeline decides per type whether to skip, degrade or abort.
 */
public abstract class LedgerException extends RuntimeException {

    protected LedgerException(String message) {
        super(message);
    }

    protected LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
