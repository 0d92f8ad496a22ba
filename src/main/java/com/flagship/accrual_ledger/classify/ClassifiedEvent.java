package com.flagship.accrual_ledger.classify;

import com.flagship.accrual_ledger.event.PaymentEvent;

/**
 * A payment event with its accounting type resolved.
 *
 * Closed set of variants; consumers dispatch through {@link Handler} so adding a variant
 * breaks every handler at compile time.
 */
public sealed interface ClassifiedEvent permits ChargeEvent, PayoutEvent, FeeEvent, ReversalEvent {

    PaymentEvent getEvent();

    EventType getType();

    <R> R accept(Handler<R> handler);

    interface Handler<R> {
        R onCharge(ChargeEvent charge);

        R onPayout(PayoutEvent payout);

        R onFee(FeeEvent fee);

        R onReversal(ReversalEvent reversal);
    }
}
