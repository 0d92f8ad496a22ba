package com.flagship.accrual_ledger.classify;

import com.flagship.accrual_ledger.event.PaymentEvent;
import lombok.Value;

import java.util.List;

/**
 * A charge with every fee row that shares its correlation id folded in.
 */
@Value
public class ChargeEvent implements ClassifiedEvent {
    PaymentEvent event;
    String correlationKey;
    long fee;
    List<String> feeEventIds;
    IncomeCategory incomeCategory;

    public long getGross() {
        return event.getGrossAmount();
    }

    public boolean hasFee() {
        return fee != 0;
    }

    @Override
    public EventType getType() {
        return EventType.CHARGE;
    }

    @Override
    public <R> R accept(Handler<R> handler) {
        return handler.onCharge(this);
    }
}
