package com.flagship.accrual_ledger.event;

import com.flagship.accrual_ledger.exception.LedgerException;
import lombok.Getter;

/**
 * The row's currency code is not recognized, or is not the currency this ledger is kept in.
 * Scope: one row.
 */
@Getter
public class UnknownCurrencyException extends LedgerException {

    private final long lineNumber;
    private final String currency;

    public UnknownCurrencyException(long lineNumber, String currency, String reason) {
        super(String.format("Row %d: currency '%s' %s", lineNumber, currency, reason));
        this.lineNumber = lineNumber;
        this.currency = currency;
    }
}
