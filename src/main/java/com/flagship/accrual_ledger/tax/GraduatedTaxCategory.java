package com.flagship.accrual_ledger.tax;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Marginal bracket table evaluated against year-to-date income.
 *
 * An event's income occupies the slice [ytd, ytd + gross) of the tax year; each bracket
 * taxes the part of that slice it overlaps. Brackets are sorted by lower bound and the
 * first starts at zero.
 */
@Value
public class GraduatedTaxCategory implements TaxCategory {
    String name;
    List<TaxBracket> brackets;

    @Override
    public BigDecimal exactWithholding(long gross, long yearToDateBefore) {
        long sliceStart = yearToDateBefore;
        long sliceEnd = Math.addExact(yearToDateBefore, gross);
        BigDecimal total = BigDecimal.ZERO;
        for (int i = 0; i < brackets.size(); i++) {
            TaxBracket bracket = brackets.get(i);
            long upper = i + 1 < brackets.size() ? brackets.get(i + 1).getLowerBound() : Long.MAX_VALUE;
            long overlap = Math.min(upper, sliceEnd) - Math.max(bracket.getLowerBound(), sliceStart);
            if (overlap > 0) {
                total = total.add(BigDecimal.valueOf(overlap).multiply(bracket.getRate()));
            }
        }
        return total;
    }
}
