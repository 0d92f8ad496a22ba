package com.flagship.accrual_ledger.classify;

import com.flagship.accrual_ledger.event.PaymentEvent;
import lombok.Value;

/**
 * Transfer of the processor balance to the bank.
 */
@Value
public class PayoutEvent implements ClassifiedEvent {
    PaymentEvent event;

    /**
     * Cash leaving the processor balance. Payout rows are negative, so this is usually positive;
     * a returned payout comes out negative.
     */
    public long getNetAmount() {
        return -event.getGrossAmount();
    }

    @Override
    public EventType getType() {
        return EventType.PAYOUT;
    }

    @Override
    public <R> R accept(Handler<R> handler) {
        return handler.onPayout(this);
    }
}
