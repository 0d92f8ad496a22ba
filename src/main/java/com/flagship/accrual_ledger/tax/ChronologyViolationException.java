package com.flagship.accrual_ledger.tax;

import com.flagship.accrual_ledger.exception.LedgerException;

import java.time.Instant;

/**
 * Running totals were asked to move backwards in time. Graduated brackets computed
 * from such a state would be silently wrong, so the run is aborted.
 */
public class ChronologyViolationException extends LedgerException {

    public ChronologyViolationException(Instant at, Instant lastChangeAt) {
        super(String.format("Tax running totals last advanced at %s, cannot process event at %s",
                lastChangeAt, at));
    }
}
