package com.flagship.accrual_ledger.export;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.flagship.accrual_ledger.LedgerFixtures;
import com.flagship.accrual_ledger.config.JacksonConfig;
import com.flagship.accrual_ledger.ledger.Transaction;
import com.flagship.accrual_ledger.pipeline.LedgerRun;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.flagship.accrual_ledger.LedgerFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class GnuCashCsvExporterTest {

    private final CsvMapper csvMapper = new JacksonConfig().csvMapper();
    private final GnuCashCsvExporter exporter = new GnuCashCsvExporter(csvMapper);

    private List<String[]> parse(String csv) throws Exception {
        try (MappingIterator<String[]> it = csvMapper.readerFor(String[].class)
                .with(CsvParser.Feature.WRAP_AS_ARRAY)
                .readValues(csv)) {
            return it.readAll();
        }
    }

    private static List<Transaction> transactions() {
        LedgerRun run = LedgerFixtures.pipeline(new SimpleMeterRegistry()).run(List.of(
                row(2, "ch_1", "2024-01-15T10:00:00Z", "charge", "100.00", "ch_1", "Pro plan"),
                row(3, "fee_1", "2024-01-15T10:00:00Z", "stripe_fee", "-2.90", "ch_1", ""),
                row(4, "po_1", "2024-01-17T00:00:00Z", "payout", "-97.10", null, "")));
        return run.getTransactions();
    }

    @Test
    @DisplayName("One line per split, date and description only on the first")
    void testMultiSplitLayout() throws Exception {
        List<Transaction> transactions = transactions();
        int splits = transactions.stream().mapToInt(t -> t.getSplits().size()).sum();

        List<String[]> lines = parse(exporter.export(transactions));

        assertArrayEquals(new String[]{"Date", "Description", "Account", "Amount", "Notes"}, lines.get(0));
        assertEquals(1 + splits, lines.size());

        String[] first = lines.get(1);
        assertEquals("2024-01-15", first[0]);
        assertEquals("Subscription: Pro plan", first[1]);

        String[] second = lines.get(2);
        assertEquals("", second[0]);
        assertEquals("", second[1]);

        int payoutStart = 1 + transactions.get(0).getSplits().size();
        assertEquals("2024-01-17", lines.get(payoutStart)[0]);
        assertEquals("Payout", lines.get(payoutStart)[1]);
    }

    @Test
    @DisplayName("Amounts are signed major units")
    void testAmounts() throws Exception {
        List<String[]> lines = parse(exporter.export(transactions()));

        assertTrue(lines.stream().anyMatch(l -> l[2].equals(REVENUE) && l[3].equals("-100.00")));
        assertTrue(lines.stream().anyMatch(l -> l[2].equals(BANK) && l[3].equals("97.10")));
        assertTrue(lines.stream().anyMatch(l -> l[2].equals(taxLiability("FICA")) && l[3].equals("-15.30")));
    }

    @Test
    @DisplayName("Minor units convert with the currency's digits")
    void testMajorUnits() {
        assertEquals("0.05", GnuCashCsvExporter.majorUnits(5, 2));
        assertEquals("-1234.56", GnuCashCsvExporter.majorUnits(-123456, 2));
        assertEquals("1500", GnuCashCsvExporter.majorUnits(1500, 0));
    }

    @Test
    @DisplayName("No transactions gives just the header")
    void testEmpty() throws Exception {
        List<String[]> lines = parse(exporter.export(List.of()));

        assertEquals(1, lines.size());
    }
}
