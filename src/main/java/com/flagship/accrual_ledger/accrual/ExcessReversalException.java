package com.flagship.accrual_ledger.accrual;

import com.flagship.accrual_ledger.exception.LedgerException;
import lombok.Getter;

/**
 * A reversal asks for more than is left unreversed on its charge. The remainder is reversed
 * against the charge and the excess is posted standalone.
 */
@Getter
public class ExcessReversalException extends LedgerException {

    private final String eventId;
    private final long excess;

    public ExcessReversalException(String eventId, String chargeEventId, long requested, long remaining) {
        super(String.format("Reversal %s requests %d but only %d remains on charge %s",
                eventId, requested, remaining, chargeEventId));
        this.eventId = eventId;
        this.excess = requested - remaining;
    }
}
