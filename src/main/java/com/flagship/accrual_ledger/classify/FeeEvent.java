package com.flagship.accrual_ledger.classify;

import com.flagship.accrual_ledger.event.PaymentEvent;
import lombok.Value;

/**
 * A processor fee with no charge to merge into, such as a monthly billing fee.
 */
@Value
public class FeeEvent implements ClassifiedEvent {
    PaymentEvent event;

    /**
     * Fee expense incurred. Fee rows are negative; a fee credit comes out negative.
     */
    public long getAmount() {
        return -event.getGrossAmount();
    }

    @Override
    public EventType getType() {
        return EventType.FEE;
    }

    @Override
    public <R> R accept(Handler<R> handler) {
        return handler.onFee(this);
    }
}
