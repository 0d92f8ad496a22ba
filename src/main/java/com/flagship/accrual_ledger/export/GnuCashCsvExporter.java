package com.flagship.accrual_ledger.export;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.flagship.accrual_ledger.ledger.Split;
import com.flagship.accrual_ledger.ledger.Transaction;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.util.List;

/**
 * Renders transactions in the GnuCash multi-split CSV import layout.
 *
 * One line per split. Date and description appear only on the first split of a
 * transaction, which is how the GnuCash importer recognizes where the next one starts.
 * Amounts are signed major units (positive = debit).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GnuCashCsvExporter {

    private static final Line HEADER = new Line("Date", "Description", "Account", "Amount", "Notes");

    private final CsvMapper csvMapper;

    public String export(List<Transaction> transactions) {
        StringWriter out = new StringWriter();
        write(transactions, out);
        return out.toString();
    }

    public void write(List<Transaction> transactions, Writer out) {
        CsvSchema schema = csvMapper.schemaFor(Line.class);
        int lines = 0;
        try (SequenceWriter writer = csvMapper.writer(schema).writeValues(out)) {
            // written as a row so an empty export still carries the header
            writer.write(HEADER);
            for (Transaction transaction : transactions) {
                boolean first = true;
                for (Split split : transaction.getSplits()) {
                    writer.write(new Line(
                            first ? transaction.getDate().toString() : "",
                            first ? transaction.getDescription() : "",
                            split.getAccountIdentifier(),
                            majorUnits(split.getAmount(), transaction.getCurrency().getMinorUnitDigits()),
                            split.getMemo()));
                    first = false;
                    lines++;
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write GnuCash CSV", e);
        }
        log.debug("Exported GnuCash CSV: transactions={}, lines={}", transactions.size(), lines);
    }

    static String majorUnits(long minorUnits, int digits) {
        return BigDecimal.valueOf(minorUnits, digits).toPlainString();
    }

    @Value
    @JsonPropertyOrder({"Date", "Description", "Account", "Amount", "Notes"})
    static class Line {
        @JsonProperty("Date")
        String date;
        @JsonProperty("Description")
        String description;
        @JsonProperty("Account")
        String account;
        @JsonProperty("Amount")
        String amount;
        @JsonProperty("Notes")
        String notes;
    }
}
