package com.flagship.accrual_ledger.ledger;

import com.flagship.accrual_ledger.exception.LedgerException;
import lombok.Getter;

/**
 * The splits of a transaction candidate do not sum to zero.
 * The transaction is never emitted and the run is aborted.
 */
@Getter
public class UnbalancedTransactionException extends LedgerException {

    private final String eventId;
    private final long imbalance;

    public UnbalancedTransactionException(String eventId, long imbalance) {
        super(String.format("Transaction for event %s is not balanced: splits sum to %d", eventId, imbalance));
        this.eventId = eventId;
        this.imbalance = imbalance;
    }
}
