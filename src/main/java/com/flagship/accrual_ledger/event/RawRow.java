package com.flagship.accrual_ledger.event;

import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One input row as handed over by an import adapter: field name to raw value.
 */
@Value
public class RawRow {

    public static final String ID = "id";
    public static final String TIMESTAMP = "timestamp";
    public static final String TYPE = "type";
    public static final String GROSS_AMOUNT = "grossAmount";
    public static final String CURRENCY = "currency";
    public static final String CORRELATION_ID = "correlationId";
    public static final String DESCRIPTION = "description";

    long lineNumber;
    Map<String, String> fields;

    public RawRow(long lineNumber, Map<String, String> fields) {
        this.lineNumber = lineNumber;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * Returns the trimmed value of a field, empty when absent or blank.
     */
    public Optional<String> field(String name) {
        String value = fields.get(name);
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? Optional.empty() : Optional.of(trimmed);
    }
}
