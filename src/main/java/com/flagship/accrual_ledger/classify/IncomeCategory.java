package com.flagship.accrual_ledger.classify;

import java.util.List;
import java.util.Locale;

/**
 * Revenue stream of a charge. Selects the revenue account the charge is credited to.
 */
public enum IncomeCategory {
    SUBSCRIPTION,
    INVOICE;

    private static final List<String> INVOICE_KEYWORDS = List.of("payment for invoice");

    /**
     * Invoice payments are recognized by description first, then by the "payment" raw type.
     * Everything else billed through the processor is subscription income.
     */
    public static IncomeCategory detect(String rawType, String description) {
        String text = description == null ? "" : description.toLowerCase(Locale.ROOT);
        for (String keyword : INVOICE_KEYWORDS) {
            if (text.contains(keyword)) {
                return INVOICE;
            }
        }
        return "payment".equals(rawType) ? INVOICE : SUBSCRIPTION;
    }
}
