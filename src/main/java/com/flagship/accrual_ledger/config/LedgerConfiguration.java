package com.flagship.accrual_ledger.config;

import com.flagship.accrual_ledger.accrual.AccrualSplitter;
import com.flagship.accrual_ledger.event.EventNormalizer;
import com.flagship.accrual_ledger.exception.ConfigurationException;
import com.flagship.accrual_ledger.ledger.AccountMapping;
import com.flagship.accrual_ledger.ledger.AccountRole;
import com.flagship.accrual_ledger.ledger.LedgerAssembler;
import com.flagship.accrual_ledger.tax.FlatRateTaxCategory;
import com.flagship.accrual_ledger.tax.GraduatedTaxCategory;
import com.flagship.accrual_ledger.tax.TaxBracket;
import com.flagship.accrual_ledger.tax.TaxCategory;
import com.flagship.accrual_ledger.tax.TaxEngine;
import com.flagship.accrual_ledger.tax.TaxTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds the engine components from {@link LedgerProperties}.
 *
 * Every problem with the account mapping or tax table surfaces here as a
 * {@link ConfigurationException}, so the application fails at startup before any event
 * is processed.
 */
@Configuration
@EnableConfigurationProperties(LedgerProperties.class)
@Slf4j
public class LedgerConfiguration {

    @Bean
    public ZoneId ledgerZone(LedgerProperties properties) {
        try {
            return ZoneId.of(properties.getZone());
        } catch (DateTimeException e) {
            throw new ConfigurationException("Invalid ledger.zone: " + properties.getZone(), e);
        }
    }

    @Bean
    public AccountMapping accountMapping(LedgerProperties properties) {
        return buildAccountMapping(properties);
    }

    @Bean
    public TaxTable taxTable(LedgerProperties properties) {
        return buildTaxTable(properties);
    }

    @Bean
    public EventNormalizer eventNormalizer(LedgerProperties properties, ZoneId ledgerZone) {
        return new EventNormalizer(properties.getAmountFormat(), ledgerZone, properties.getCurrency());
    }

    @Bean
    public TaxEngine taxEngine(TaxTable taxTable, ZoneId ledgerZone) {
        return new TaxEngine(taxTable, ledgerZone);
    }

    @Bean
    public AccrualSplitter accrualSplitter(AccountMapping accountMapping, TaxEngine taxEngine) {
        return new AccrualSplitter(accountMapping, taxEngine);
    }

    @Bean
    public LedgerAssembler ledgerAssembler(ZoneId ledgerZone) {
        return new LedgerAssembler(ledgerZone);
    }

    static AccountMapping buildAccountMapping(LedgerProperties properties) {
        LedgerProperties.Accounts accounts = properties.getAccounts();
        AccountMapping.Builder builder = AccountMapping.builder()
                .role(AccountRole.REVENUE, accounts.getRevenue())
                .role(AccountRole.INVOICE_REVENUE, accounts.getInvoiceRevenue() != null
                        ? accounts.getInvoiceRevenue()
                        : accounts.getRevenue())
                .role(AccountRole.ACCRUAL_CLEARING, accounts.getAccrualClearing())
                .role(AccountRole.PROCESSING_FEE_EXPENSE, accounts.getProcessingFeeExpense())
                .role(AccountRole.BILLING_FEE_EXPENSE, accounts.getBillingFeeExpense() != null
                        ? accounts.getBillingFeeExpense()
                        : accounts.getProcessingFeeExpense())
                .role(AccountRole.BANK, accounts.getBank())
                .role(AccountRole.UNMATCHED_REVERSAL, accounts.getUnmatchedReversal())
                .role(AccountRole.TAX_ROUNDING_EXPENSE, accounts.getTaxRoundingExpense())
                .role(AccountRole.TAX_ROUNDING_LIABILITY, accounts.getTaxRoundingLiability());

        for (Map.Entry<String, LedgerProperties.TaxCategory> entry : properties.getTaxCategories().entrySet()) {
            builder.taxAccounts(entry.getKey(), entry.getValue().getExpenseAccount(),
                    entry.getValue().getLiabilityAccount());
            if (entry.getValue().getWithholdingAccount() != null) {
                builder.withholdingAccount(entry.getKey(), entry.getValue().getWithholdingAccount());
            }
        }
        AccountMapping mapping = builder.build();
        log.info("Account mapping loaded: clearing={}, bank={}, taxCategories={}, withholdingOnPayout={}",
                mapping.get(AccountRole.ACCRUAL_CLEARING).getIdentifier(),
                mapping.get(AccountRole.BANK).getIdentifier(),
                properties.getTaxCategories().keySet(),
                mapping.getWithholdingCategories());
        return mapping;
    }

    static TaxTable buildTaxTable(LedgerProperties properties) {
        int digits = properties.getCurrency().getMinorUnitDigits();
        List<TaxCategory> categories = new ArrayList<>();
        for (Map.Entry<String, LedgerProperties.TaxCategory> entry : properties.getTaxCategories().entrySet()) {
            String name = entry.getKey();
            LedgerProperties.TaxCategory category = entry.getValue();
            if (category.getKind() == LedgerProperties.Kind.GRADUATED) {
                List<TaxBracket> brackets = new ArrayList<>();
                for (LedgerProperties.Bracket bracket : category.getBrackets()) {
                    brackets.add(new TaxBracket(toMinorUnits(name, bracket, digits), bracket.getRate()));
                }
                categories.add(new GraduatedTaxCategory(name, List.copyOf(brackets)));
            } else {
                categories.add(new FlatRateTaxCategory(name, category.getRate()));
            }
        }
        return new TaxTable(categories);
    }

    private static long toMinorUnits(String category, LedgerProperties.Bracket bracket, int digits) {
        if (bracket.getFrom() == null) {
            throw new ConfigurationException("Bracket of " + category + " has no lower bound");
        }
        try {
            return bracket.getFrom().movePointRight(digits).longValueExact();
        } catch (ArithmeticException e) {
            throw new ConfigurationException("Bracket bound " + bracket.getFrom() + " of " + category
                    + " is not expressible in minor units", e);
        }
    }
}
