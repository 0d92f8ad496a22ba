package com.flagship.accrual_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.accrual_ledger.event.RawRow;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One raw processor row in a JSON request. Values stay text; the normalizer parses them.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class RowRequest {

    @JsonProperty("id")
    private String id;

    @JsonProperty("timestamp")
    private String timestamp;

    @JsonProperty("type")
    private String type;

    @JsonProperty("gross_amount")
    private String grossAmount;

    @JsonProperty("currency")
    private String currency;

    @JsonProperty("correlation_id")
    private String correlationId;

    @JsonProperty("description")
    private String description;

    public RawRow toRawRow(long lineNumber) {
        Map<String, String> fields = new LinkedHashMap<>();
        put(fields, RawRow.ID, id);
        put(fields, RawRow.TIMESTAMP, timestamp);
        put(fields, RawRow.TYPE, type);
        put(fields, RawRow.GROSS_AMOUNT, grossAmount);
        put(fields, RawRow.CURRENCY, currency);
        put(fields, RawRow.CORRELATION_ID, correlationId);
        put(fields, RawRow.DESCRIPTION, description);
        return new RawRow(lineNumber, fields);
    }

    private static void put(Map<String, String> fields, String name, String value) {
        if (value != null) {
            fields.put(name, value);
        }
    }
}
