package com.flagship.accrual_ledger.event;

import lombok.Value;

import java.time.Instant;

/**
 * A normalized payment-processor event. Created once from one input row, never mutated.
 *
 * grossAmount is signed and expressed in minor units of the currency: money entering the
 * processor balance is positive, money leaving it (refunds, fees, payouts) is negative.
 */
@Value
public class PaymentEvent {
    String id;
    long lineNumber;
    Instant timestamp;
    long grossAmount;
    CurrencyCode currency;
    String rawType;
    String correlationId;
    String description;

    public boolean hasCorrelationId() {
        return correlationId != null && !correlationId.isBlank();
    }

    public boolean isNegative() {
        return grossAmount < 0;
    }
}
