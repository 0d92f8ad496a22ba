package com.flagship.accrual_ledger.tax;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Fixed percentage of gross, independent of year-to-date income.
 */
@Value
public class FlatRateTaxCategory implements TaxCategory {
    String name;
    BigDecimal rate;

    @Override
    public BigDecimal exactWithholding(long gross, long yearToDateBefore) {
        return BigDecimal.valueOf(gross).multiply(rate);
    }
}
