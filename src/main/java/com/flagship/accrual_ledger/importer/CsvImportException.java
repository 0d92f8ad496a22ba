package com.flagship.accrual_ledger.importer;

import com.flagship.accrual_ledger.exception.LedgerException;

/**
 * The export file itself cannot be read: unreadable CSV or missing header columns.
 * Scope: whole request, nothing is imported.
 */
public class CsvImportException extends LedgerException {

    public CsvImportException(String message) {
        super(message);
    }

    public CsvImportException(String message, Throwable cause) {
        super(message, cause);
    }
}
