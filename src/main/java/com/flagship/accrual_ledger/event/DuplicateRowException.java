package com.flagship.accrual_ledger.event;

import com.flagship.accrual_ledger.exception.LedgerException;
import lombok.Getter;

/**
 * A row repeats the id of a row already accepted in the same run, as happens when
 * overlapping exports are combined. Scope: one row. The repeat is skipped.
 */
@Getter
public class DuplicateRowException extends LedgerException {

    private final String eventId;
    private final long firstLineNumber;

    public DuplicateRowException(String eventId, long lineNumber, long firstLineNumber) {
        super(String.format("Row %d repeats event %s first seen on row %d", lineNumber, eventId, firstLineNumber));
        this.eventId = eventId;
        this.firstLineNumber = firstLineNumber;
    }
}
