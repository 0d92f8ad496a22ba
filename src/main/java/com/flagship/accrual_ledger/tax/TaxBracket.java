package com.flagship.accrual_ledger.tax;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Marginal rate applying from {@code lowerBound} (inclusive, minor units of yearly income)
 * up to the next bracket's lower bound.
 */
@Value
public class TaxBracket {
    long lowerBound;
    BigDecimal rate;
}
