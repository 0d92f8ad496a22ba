package com.flagship.accrual_ledger.tax;

import java.math.BigDecimal;

/**
 * A withholding category such as FICA, Federal or State.
 */
public sealed interface TaxCategory permits FlatRateTaxCategory, GraduatedTaxCategory {

    String getName();

    /**
     * Exact, unrounded withholding for income of {@code gross} minor units earned on top of
     * {@code yearToDateBefore} minor units already earned in the same tax year.
     */
    BigDecimal exactWithholding(long gross, long yearToDateBefore);
}
