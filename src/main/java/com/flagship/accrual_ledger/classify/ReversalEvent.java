package com.flagship.accrual_ledger.classify;

import com.flagship.accrual_ledger.event.PaymentEvent;
import lombok.Value;

/**
 * Refund, adjustment or dispute. Reverses (part of) the charge identified by the
 * correlation id, or stands alone when no such charge was posted.
 */
@Value
public class ReversalEvent implements ClassifiedEvent {
    PaymentEvent event;
    EventType type;

    public String getCorrelationId() {
        return event.getCorrelationId();
    }

    /**
     * Magnitude of the reversal in minor units.
     */
    public long getAmount() {
        return Math.abs(event.getGrossAmount());
    }

    @Override
    public <R> R accept(Handler<R> handler) {
        return handler.onReversal(this);
    }
}
