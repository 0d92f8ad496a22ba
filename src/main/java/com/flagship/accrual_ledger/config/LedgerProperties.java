package com.flagship.accrual_ledger.config;

import com.flagship.accrual_ledger.event.AmountFormat;
import com.flagship.accrual_ledger.event.CurrencyCode;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Externalized configuration under the {@code ledger} prefix: ledger currency, raw amount
 * format, time zone, account mapping and tax categories.
 */
@ConfigurationProperties(prefix = "ledger")
@Getter
@Setter
public class LedgerProperties {

    private CurrencyCode currency = CurrencyCode.USD;
    private AmountFormat amountFormat = AmountFormat.MAJOR_UNITS;
    /** Zone for dates, tax years and timestamps without an offset. */
    private String zone = "UTC";
    private Accounts accounts = new Accounts();
    /** Tax categories by name, in posting order. */
    private Map<String, TaxCategory> taxCategories = new LinkedHashMap<>();

    @Getter
    @Setter
    public static class Accounts {
        private String revenue;
        private String invoiceRevenue;
        private String accrualClearing;
        private String processingFeeExpense;
        private String billingFeeExpense;
        private String bank;
        private String unmatchedReversal;
        private String taxRoundingExpense;
        private String taxRoundingLiability;
    }

    @Getter
    @Setter
    public static class TaxCategory {
        private Kind kind = Kind.FLAT;
        /** Rate for FLAT categories, as a fraction (0.153 for 15.3%). */
        private BigDecimal rate;
        private List<Bracket> brackets = new ArrayList<>();
        private String expenseAccount;
        private String liabilityAccount;
        /** Optional asset account that payouts fund with the withholding reserved for this category. */
        private String withholdingAccount;
    }

    @Getter
    @Setter
    public static class Bracket {
        /** Lower bound of yearly income in major units of the ledger currency. */
        private BigDecimal from = BigDecimal.ZERO;
        private BigDecimal rate;
    }

    public enum Kind {
        FLAT,
        GRADUATED
    }
}
