package com.flagship.accrual_ledger.event;

import java.util.Locale;
import java.util.Optional;

/**
 * Currency code enum following ISO-4217 standard.
 *
 * Carries the number of minor-unit digits so decimal amounts can be converted
 * to integer minor units without floating point.
 */
public enum CurrencyCode {
    USD(2), // US Dollar
    EUR(2), // Euro
    GBP(2), // British Pound
    INR(2), // Indian Rupee
    JPY(0), // Japanese Yen
    CAD(2), // Canadian Dollar
    AUD(2), // Australian Dollar
    CHF(2); // Swiss Franc

    private final int minorUnitDigits;

    CurrencyCode(int minorUnitDigits) {
        this.minorUnitDigits = minorUnitDigits;
    }

    public int getMinorUnitDigits() {
        return minorUnitDigits;
    }

    /**
     * Case-insensitive lookup. Processors report lower-case codes ("usd").
     */
    public static Optional<CurrencyCode> parse(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(CurrencyCode.valueOf(code.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
