package com.flagship.accrual_ledger.tax;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Year-to-date income per tax year, plus the instant of the last committed change.
 *
 * Immutable. The caller threads it through the engine in event order and replaces its
 * reference only once the owning transaction has been assembled, so a rejected
 * transaction never advances the running totals.
 */
public final class TaxState {

    private static final TaxState INITIAL = new TaxState(new TreeMap<>(), null);

    private final Map<Integer, Long> yearToDate;
    private final Instant lastChangeAt;

    private TaxState(Map<Integer, Long> yearToDate, Instant lastChangeAt) {
        this.yearToDate = Collections.unmodifiableMap(yearToDate);
        this.lastChangeAt = lastChangeAt;
    }

    public static TaxState initial() {
        return INITIAL;
    }

    /**
     * Starts from totals carried over from an earlier run (e.g. income already booked this year).
     */
    public static TaxState of(Map<Integer, Long> yearToDate) {
        return new TaxState(new TreeMap<>(yearToDate), null);
    }

    public long yearToDate(int taxYear) {
        return yearToDate.getOrDefault(taxYear, 0L);
    }

    public Instant getLastChangeAt() {
        return lastChangeAt;
    }

    public Map<Integer, Long> asMap() {
        return yearToDate;
    }

    /**
     * @throws ChronologyViolationException if {@code at} precedes the last committed change
     */
    void checkChronology(Instant at) {
        if (lastChangeAt != null && at.isBefore(lastChangeAt)) {
            throw new ChronologyViolationException(at, lastChangeAt);
        }
    }

    TaxState withIncome(int taxYear, long delta, Instant at) {
        checkChronology(at);
        Map<Integer, Long> next = new TreeMap<>(yearToDate);
        long updated = Math.max(0L, Math.addExact(yearToDate(taxYear), delta));
        next.put(taxYear, updated);
        return new TaxState(next, at);
    }

    @Override
    public String toString() {
        return "TaxState{yearToDate=" + yearToDate + ", lastChangeAt=" + lastChangeAt + "}";
    }
}
