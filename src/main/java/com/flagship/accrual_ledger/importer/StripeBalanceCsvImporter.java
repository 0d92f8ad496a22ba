package com.flagship.accrual_ledger.importer;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.flagship.accrual_ledger.event.RawRow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reads a Stripe balance-history export into raw rows.
 *
 * Columns used: id, Type, Source, Amount, Fee, Currency, Created (UTC), Description.
 * Stripe reports the per-charge processing fee in the Fee column of the charge row; it is
 * emitted as a separate fee row correlated with the charge, so the classifier merges it
 * back the same way it would a standalone fee line.
 *
 * Values are passed through as text. Parsing and validation belong to the normalizer,
 * which reports bad values per row.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StripeBalanceCsvImporter {

    static final String COL_ID = "id";
    static final String COL_TYPE = "Type";
    static final String COL_SOURCE = "Source";
    static final String COL_AMOUNT = "Amount";
    static final String COL_FEE = "Fee";
    static final String COL_CURRENCY = "Currency";
    static final String COL_CREATED = "Created (UTC)";
    static final String COL_DESCRIPTION = "Description";

    private static final List<String> REQUIRED_COLUMNS =
            List.of(COL_ID, COL_TYPE, COL_AMOUNT, COL_CURRENCY, COL_CREATED);
    private static final Set<String> CHARGE_TYPES = Set.of("charge", "payment");

    private final CsvMapper csvMapper;

    public List<RawRow> read(String csv) {
        return read(new StringReader(csv));
    }

    /**
     * @throws CsvImportException if the file cannot be parsed or lacks a required column
     */
    public List<RawRow> read(Reader reader) {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        List<RawRow> rows = new ArrayList<>();
        try (MappingIterator<Map<String, String>> it = csvMapper.readerForMapOf(String.class)
                .with(schema)
                .readValues(reader)) {
            // header is line 1
            long line = 1;
            boolean headerChecked = false;
            while (it.hasNextValue()) {
                Map<String, String> record = it.nextValue();
                line++;
                if (!headerChecked) {
                    checkColumns(record);
                    headerChecked = true;
                }
                convert(line, record, rows);
            }
        } catch (IOException e) {
            throw new CsvImportException("Cannot read Stripe balance export: " + e.getMessage(), e);
        }
        log.info("Imported Stripe balance export: rows={}", rows.size());
        return rows;
    }

    private static void checkColumns(Map<String, String> record) {
        for (String column : REQUIRED_COLUMNS) {
            if (!record.containsKey(column)) {
                throw new CsvImportException("Stripe balance export is missing column '" + column + "'");
            }
        }
    }

    private static void convert(long line, Map<String, String> record, List<RawRow> rows) {
        String id = value(record, COL_ID);
        String type = value(record, COL_TYPE);
        String source = value(record, COL_SOURCE);
        boolean charge = CHARGE_TYPES.contains(type.toLowerCase(Locale.ROOT));
        String correlationId = source.isEmpty() && charge ? id : source;

        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(RawRow.ID, id);
        fields.put(RawRow.TIMESTAMP, utc(value(record, COL_CREATED)));
        fields.put(RawRow.TYPE, type);
        fields.put(RawRow.GROSS_AMOUNT, value(record, COL_AMOUNT));
        fields.put(RawRow.CURRENCY, value(record, COL_CURRENCY));
        fields.put(RawRow.CORRELATION_ID, correlationId);
        fields.put(RawRow.DESCRIPTION, value(record, COL_DESCRIPTION));
        rows.add(new RawRow(line, fields));

        String fee = value(record, COL_FEE);
        if (charge && hasFee(fee)) {
            Map<String, String> feeFields = new LinkedHashMap<>(fields);
            // a charge without an id is known as row-<line> once normalized
            String chargeId = id.isEmpty() ? "row-" + line : id;
            feeFields.put(RawRow.ID, chargeId + "-fee");
            if (correlationId.isEmpty()) {
                feeFields.put(RawRow.CORRELATION_ID, chargeId);
            }
            feeFields.put(RawRow.TYPE, "stripe_fee");
            feeFields.put(RawRow.GROSS_AMOUNT, negate(fee));
            feeFields.put(RawRow.DESCRIPTION, "Processing fee");
            rows.add(new RawRow(line, feeFields));
        }
    }

    /**
     * Fee cells that are not numeric still produce a fee row, so the normalizer reports them.
     */
    private static boolean hasFee(String fee) {
        if (fee.isEmpty()) {
            return false;
        }
        try {
            return new BigDecimal(fee.replace(",", "")).signum() != 0;
        } catch (NumberFormatException e) {
            return true;
        }
    }

    /**
     * Stripe shows the fee as a positive amount; as a balance movement it leaves the balance.
     */
    private static String negate(String fee) {
        try {
            return new BigDecimal(fee.replace(",", "")).negate().toPlainString();
        } catch (NumberFormatException e) {
            return fee;
        }
    }

    /**
     * "Created (UTC)" carries no offset; make it explicit so the ledger zone does not apply.
     */
    private static String utc(String created) {
        if (created.isEmpty() || created.endsWith("Z")) {
            return created;
        }
        if (created.length() == 10) {
            return created + "T00:00Z";
        }
        return created.replace(' ', 'T') + "Z";
    }

    private static String value(Map<String, String> record, String column) {
        String value = record.get(column);
        return value == null ? "" : value.trim();
    }
}
