package com.flagship.accrual_ledger.tax;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Computes tax withholding for revenue against an explicit running-total state.
 *
 * Rounding policy:
 * 1. Each category is truncated toward zero
 * 2. The difference between the half-up rounded exact total and the sum of the truncated
 *    amounts is reported as a single rounding remainder
 * 3. The caller posts the remainder as one rounding adjustment in the same transaction
 *
 * The engine holds no mutable state. Year-to-date income is read from the {@link TaxState}
 * passed in and the advanced state is returned, never stored.
 */
@Slf4j
public class TaxEngine {

    private final TaxTable table;
    private final ZoneId zone;

    public TaxEngine(TaxTable table, ZoneId zone) {
        this.table = table;
        this.zone = zone;
    }

    public int taxYear(Instant at) {
        return at.atZone(zone).getYear();
    }

    /**
     * Assesses withholding on revenue earned at {@code at}.
     *
     * @param gross revenue in minor units, not negative
     * @param at    when the revenue was earned; must not precede the state's last change
     * @param state running totals before this revenue
     * @return per-category amounts and the state after this revenue
     * @throws ChronologyViolationException if {@code at} is out of order
     */
    public TaxAssessment assess(long gross, Instant at, TaxState state) {
        if (gross < 0) {
            throw new IllegalArgumentException("Cannot assess negative revenue: " + gross);
        }
        state.checkChronology(at);
        int year = taxYear(at);
        long before = state.yearToDate(year);

        Map<String, Long> withheld = new LinkedHashMap<>();
        BigDecimal exactTotal = BigDecimal.ZERO;
        long truncatedTotal = 0;
        for (TaxCategory category : table.getCategories()) {
            BigDecimal exact = category.exactWithholding(gross, before);
            long truncated = exact.setScale(0, RoundingMode.DOWN).longValueExact();
            withheld.put(category.getName(), truncated);
            exactTotal = exactTotal.add(exact);
            truncatedTotal = Math.addExact(truncatedTotal, truncated);
        }
        long remainder = exactTotal.setScale(0, RoundingMode.HALF_UP).longValueExact() - truncatedTotal;

        log.debug("Assessed withholding: gross={}, taxYear={}, ytdBefore={}, withheld={}, rounding={}",
                gross, year, before, withheld, remainder);

        return new TaxAssessment(Collections.unmodifiableMap(withheld), remainder,
                state.withIncome(year, gross, at));
    }

    /**
     * Removes reversed revenue from the year-to-date income of the tax year it was earned
     * in. Totals never drop below zero.
     *
     * @param amount   reversed revenue in minor units
     * @param earnedAt when the reversed revenue was earned
     * @param at       when the reversal happened; must not precede the state's last change
     * @throws ChronologyViolationException if {@code at} is out of order
     */
    public TaxState reverse(long amount, Instant earnedAt, Instant at, TaxState state) {
        if (amount < 0) {
            throw new IllegalArgumentException("Cannot reverse a negative amount: " + amount);
        }
        return state.withIncome(taxYear(earnedAt), -amount, at);
    }
}
