package com.flagship.accrual_ledger.accrual;

import com.flagship.accrual_ledger.exception.LedgerException;
import lombok.Getter;

/**
 * A refund, adjustment or dispute whose charge cannot be traced.
 * Scope: one event; degraded to a standalone reversal.
 */
@Getter
public class OrphanRefundException extends LedgerException {

    private final String eventId;
    private final String correlationId;

    public OrphanRefundException(String eventId, String correlationId) {
        super(correlationId == null
                ? String.format("Reversal %s has no correlation id", eventId)
                : String.format("Reversal %s references unknown charge %s", eventId, correlationId));
        this.eventId = eventId;
        this.correlationId = correlationId;
    }
}
