package com.flagship.accrual_ledger.event;

import com.flagship.accrual_ledger.exception.LedgerException;
import lombok.Getter;

/**
 * A required field is absent, or an amount or timestamp cannot be parsed.
 * Scope: one row. The row is skipped and the run continues.
 */
@Getter
public class MalformedRowException extends LedgerException {

    private final long lineNumber;

    public MalformedRowException(long lineNumber, String message) {
        super(String.format("Malformed row %d: %s", lineNumber, message));
        this.lineNumber = lineNumber;
    }

    public MalformedRowException(long lineNumber, String message, Throwable cause) {
        super(String.format("Malformed row %d: %s", lineNumber, message), cause);
        this.lineNumber = lineNumber;
    }
}
