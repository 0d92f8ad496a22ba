package com.flagship.accrual_ledger.config;

import com.flagship.accrual_ledger.exception.ConfigurationException;
import com.flagship.accrual_ledger.ledger.AccountMapping;
import com.flagship.accrual_ledger.ledger.AccountRole;
import com.flagship.accrual_ledger.tax.GraduatedTaxCategory;
import com.flagship.accrual_ledger.tax.TaxEngine;
import com.flagship.accrual_ledger.tax.TaxTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Binding and validation of the ledger.* properties at startup.
 */
class LedgerConfigurationTest {

    private static final String[] ACCOUNTS = {
            "ledger.accounts.revenue=Income:Subscriptions",
            "ledger.accounts.accrual-clearing=Assets:Stripe Balance",
            "ledger.accounts.processing-fee-expense=Expenses:Fees",
            "ledger.accounts.bank=Assets:Checking",
            "ledger.accounts.unmatched-reversal=Liabilities:Unmatched",
            "ledger.accounts.tax-rounding-expense=Expenses:Taxes:Rounding",
            "ledger.accounts.tax-rounding-liability=Liabilities:Taxes:Rounding",
            "ledger.tax-categories.fica.rate=0.153",
            "ledger.tax-categories.fica.expense-account=Expenses:Taxes:FICA",
            "ledger.tax-categories.fica.liability-account=Liabilities:Taxes:FICA"
    };

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(LedgerConfiguration.class)
            .withPropertyValues(ACCOUNTS);

    private static void assertFailsWithConfigurationError(Throwable failure) {
        assertNotNull(failure, "context should fail to start");
        Throwable cause = failure;
        while (cause != null && !(cause instanceof ConfigurationException)) {
            cause = cause.getCause();
        }
        assertNotNull(cause, "expected a ConfigurationException in the cause chain of " + failure);
    }

    @Test
    @DisplayName("A complete configuration builds the engine components")
    void testValidConfiguration() {
        runner.run(context -> {
            assertNull(context.getStartupFailure());
            AccountMapping mapping = context.getBean(AccountMapping.class);
            assertEquals("Assets:Checking", mapping.get(AccountRole.BANK).getIdentifier());
            // optional roles fall back to their general counterparts
            assertEquals("Income:Subscriptions", mapping.get(AccountRole.INVOICE_REVENUE).getIdentifier());
            assertEquals("Expenses:Fees", mapping.get(AccountRole.BILLING_FEE_EXPENSE).getIdentifier());
            assertEquals("Liabilities:Taxes:FICA", mapping.taxLiability("fica").getIdentifier());
            assertNotNull(context.getBean(TaxEngine.class));
            assertEquals(1, context.getBean(TaxTable.class).getCategories().size());
        });
    }

    @Test
    @DisplayName("Withholding accounts are optional and bound per tax category")
    void testWithholdingAccounts() {
        runner.run(context ->
                assertTrue(context.getBean(AccountMapping.class).getWithholdingCategories().isEmpty()));

        runner.withPropertyValues("ledger.tax-categories.fica.withholding-account=Assets:Withholding:FICA")
                .run(context -> {
                    assertNull(context.getStartupFailure());
                    AccountMapping mapping = context.getBean(AccountMapping.class);
                    assertEquals(List.of("fica"), mapping.getWithholdingCategories());
                    assertEquals("Assets:Withholding:FICA",
                            mapping.withholding("fica").orElseThrow().getIdentifier());
                });
    }

    @Test
    @DisplayName("Graduated bracket bounds are converted to minor units")
    void testGraduatedBrackets() {
        runner.withPropertyValues(
                "ledger.tax-categories.federal.kind=GRADUATED",
                "ledger.tax-categories.federal.brackets[0].from=0",
                "ledger.tax-categories.federal.brackets[0].rate=0.10",
                "ledger.tax-categories.federal.brackets[1].from=11600",
                "ledger.tax-categories.federal.brackets[1].rate=0.12",
                "ledger.tax-categories.federal.expense-account=Expenses:Taxes:Federal",
                "ledger.tax-categories.federal.liability-account=Liabilities:Taxes:Federal"
        ).run(context -> {
            assertNull(context.getStartupFailure());
            GraduatedTaxCategory federal = context.getBean(TaxTable.class).getCategories().stream()
                    .filter(GraduatedTaxCategory.class::isInstance)
                    .map(GraduatedTaxCategory.class::cast)
                    .findFirst()
                    .orElseThrow();
            assertEquals(1_160_000L, federal.getBrackets().get(1).getLowerBound());
            assertEquals(new BigDecimal("0.12"), federal.getBrackets().get(1).getRate());
        });
    }

    @Test
    @DisplayName("An unmapped account role stops startup")
    void testMissingAccount() {
        runner.withPropertyValues("ledger.accounts.bank=")
                .run(context -> assertFailsWithConfigurationError(context.getStartupFailure()));
    }

    @Test
    @DisplayName("A tax category without accounts stops startup")
    void testCategoryWithoutAccounts() {
        runner.withPropertyValues("ledger.tax-categories.state.rate=0.05")
                .run(context -> assertFailsWithConfigurationError(context.getStartupFailure()));
    }

    @Test
    @DisplayName("A rate outside 0..1 stops startup")
    void testInvalidRate() {
        runner.withPropertyValues("ledger.tax-categories.fica.rate=1.53")
                .run(context -> assertFailsWithConfigurationError(context.getStartupFailure()));
    }

    @Test
    @DisplayName("An unknown zone stops startup")
    void testInvalidZone() {
        runner.withPropertyValues("ledger.zone=Mars/Olympus")
                .run(context -> assertFailsWithConfigurationError(context.getStartupFailure()));
    }

    @Test
    @DisplayName("Bracket bounds finer than the currency's minor unit are rejected")
    void testBracketPrecision() {
        LedgerProperties properties = new LedgerProperties();
        LedgerProperties.TaxCategory category = new LedgerProperties.TaxCategory();
        category.setKind(LedgerProperties.Kind.GRADUATED);
        LedgerProperties.Bracket bracket = new LedgerProperties.Bracket();
        bracket.setFrom(new BigDecimal("0.001"));
        bracket.setRate(new BigDecimal("0.1"));
        category.getBrackets().add(bracket);
        properties.getTaxCategories().put("income", category);

        assertThrows(ConfigurationException.class, () -> LedgerConfiguration.buildTaxTable(properties));
    }
}
