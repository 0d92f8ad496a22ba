package com.flagship.accrual_ledger.tax;

import lombok.Value;

import java.util.Map;

/**
 * Result of assessing one charge: truncated withholding per category, the rounding
 * remainder that brings the total to the half-up rounded exact amount, and the state to
 * commit once the charge's transaction is accepted.
 */
@Value
public class TaxAssessment {
    Map<String, Long> withheld;
    long roundingRemainder;
    TaxState nextState;

    public long totalWithheld() {
        return withheld.values().stream().mapToLong(Long::longValue).sum() + roundingRemainder;
    }
}
