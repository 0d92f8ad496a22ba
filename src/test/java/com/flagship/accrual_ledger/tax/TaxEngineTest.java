package com.flagship.accrual_ledger.tax;

import com.flagship.accrual_ledger.LedgerFixtures;
import com.flagship.accrual_ledger.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Withholding per category, rounding remainder and running totals.
 */
class TaxEngineTest {

    private static final Instant JAN_15 = Instant.parse("2024-01-15T10:00:00Z");

    private final TaxEngine flat = new TaxEngine(LedgerFixtures.flatTaxTable(), ZoneOffset.UTC);

    private static TaxEngine graduated() {
        GraduatedTaxCategory income = new GraduatedTaxCategory("Income", List.of(
                new TaxBracket(0, new BigDecimal("0.10")),
                new TaxBracket(100_000, new BigDecimal("0.20"))));
        return new TaxEngine(new TaxTable(List.of(income)), ZoneOffset.UTC);
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    @Test
    @DisplayName("Flat categories withhold gross times rate")
    void testFlatWithholding() {
        printTestHeader("Flat Withholding");

        TaxAssessment assessment = flat.assess(10000, JAN_15, TaxState.initial());
        printOutput("Withheld", assessment.getWithheld());

        assertEquals(Map.of("FICA", 1530L, "Federal", 1200L, "State", 500L), assessment.getWithheld());
        assertEquals(0L, assessment.getRoundingRemainder());
        assertEquals(3230L, assessment.totalWithheld());
        assertEquals(10000L, assessment.getNextState().yearToDate(2024));
    }

    @Test
    @DisplayName("Categories are truncated and the rounding difference reported once")
    void testRoundingRemainder() {
        printTestHeader("Rounding Remainder");

        // exact 50.949 + 39.96 + 16.65 = 107.559, rounds to 108
        TaxAssessment assessment = flat.assess(333, JAN_15, TaxState.initial());
        printOutput("Withheld", assessment.getWithheld());
        printOutput("Remainder", assessment.getRoundingRemainder());

        assertEquals(50L, assessment.getWithheld().get("FICA"));
        assertEquals(39L, assessment.getWithheld().get("Federal"));
        assertEquals(16L, assessment.getWithheld().get("State"));
        assertEquals(3L, assessment.getRoundingRemainder());
        assertEquals(108L, assessment.totalWithheld());
    }

    @Test
    @DisplayName("Graduated rates apply to the slice of year-to-date income the revenue occupies")
    void testGraduatedAcrossBrackets() {
        printTestHeader("Graduated Across Brackets");
        TaxEngine engine = graduated();
        TaxState state = TaxState.of(Map.of(2024, 80_000L));

        // 20,000 at 10% and 30,000 at 20%
        TaxAssessment assessment = engine.assess(50_000, JAN_15, state);
        printOutput("Withheld", assessment.getWithheld());

        assertEquals(8_000L, assessment.getWithheld().get("Income"));
        assertEquals(130_000L, assessment.getNextState().yearToDate(2024));
        assertEquals(80_000L, state.yearToDate(2024), "input state is never modified");
    }

    @Test
    @DisplayName("Running totals are kept per tax year")
    void testYearBoundary() {
        TaxEngine engine = graduated();
        TaxState state = engine.assess(150_000, Instant.parse("2024-12-31T23:00:00Z"), TaxState.initial())
                .getNextState();

        TaxAssessment january = engine.assess(1_000, Instant.parse("2025-01-01T01:00:00Z"), state);

        assertEquals(100L, january.getWithheld().get("Income"));
        assertEquals(150_000L, january.getNextState().yearToDate(2024));
        assertEquals(1_000L, january.getNextState().yearToDate(2025));
    }

    @Test
    @DisplayName("Assessing before the last change violates chronology")
    void testChronologyViolation() {
        TaxState state = flat.assess(1000, JAN_15, TaxState.initial()).getNextState();

        ChronologyViolationException e = assertThrows(ChronologyViolationException.class,
                () -> flat.assess(1000, JAN_15.minusSeconds(60), state));
        assertNotNull(e.getMessage());

        // same instant is fine
        assertDoesNotThrow(() -> flat.assess(1000, JAN_15, state));
    }

    @Test
    @DisplayName("Reversals reduce year-to-date income and never below zero")
    void testReverse() {
        TaxState state = TaxState.of(Map.of(2024, 5_000L));

        TaxState reduced = flat.reverse(2_000, JAN_15, JAN_15, state);
        TaxState floored = flat.reverse(9_000, JAN_15, JAN_15, reduced);

        assertEquals(3_000L, reduced.yearToDate(2024));
        assertEquals(0L, floored.yearToDate(2024));
        assertEquals(JAN_15, floored.getLastChangeAt());
    }

    @Test
    @DisplayName("A January refund of December revenue reduces the year it was earned in")
    void testReverseAcrossYearBoundary() {
        Instant december = Instant.parse("2024-12-20T10:00:00Z");
        Instant january = Instant.parse("2025-01-05T10:00:00Z");
        TaxState state = TaxState.of(Map.of(2024, 8_000L, 2025, 1_000L));

        TaxState reduced = flat.reverse(3_000, december, january, state);

        assertEquals(5_000L, reduced.yearToDate(2024));
        assertEquals(1_000L, reduced.yearToDate(2025));
        assertEquals(january, reduced.getLastChangeAt());
    }

    @Test
    @DisplayName("Negative amounts are rejected")
    void testNegativeAmounts() {
        assertThrows(IllegalArgumentException.class, () -> flat.assess(-1, JAN_15, TaxState.initial()));
        assertThrows(IllegalArgumentException.class, () -> flat.reverse(-1, JAN_15, JAN_15, TaxState.initial()));
    }

    @Test
    @DisplayName("Invalid tax tables are configuration errors")
    void testInvalidTables() {
        assertThrows(ConfigurationException.class, () -> new TaxTable(List.of(
                new FlatRateTaxCategory("FICA", new BigDecimal("1.5")))));
        assertThrows(ConfigurationException.class, () -> new TaxTable(List.of(
                new FlatRateTaxCategory("FICA", new BigDecimal("0.1")),
                new FlatRateTaxCategory("FICA", new BigDecimal("0.2")))));
        assertThrows(ConfigurationException.class, () -> new TaxTable(List.of(
                new GraduatedTaxCategory("Income", List.of(new TaxBracket(100, new BigDecimal("0.1")))))));
        assertThrows(ConfigurationException.class, () -> new TaxTable(List.of(
                new GraduatedTaxCategory("Income", List.of(
                        new TaxBracket(0, new BigDecimal("0.1")),
                        new TaxBracket(0, new BigDecimal("0.2")))))));
    }
}
