package com.flagship.accrual_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.accrual_ledger.event.RawRow;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Request DTO for synthesizing transactions from JSON rows.
 *
 * year_to_date optionally carries income already booked per tax year (minor units), so
 * graduated brackets continue where an earlier run stopped.
 */
@Getter
@Setter
@NoArgsConstructor
public class SynthesizeRequest {

    @NotNull(message = "Rows are required")
    @Valid
    @JsonProperty("rows")
    private List<@NotNull(message = "Row must not be null") RowRequest> rows;

    @JsonProperty("year_to_date")
    private Map<Integer, Long> yearToDate = new LinkedHashMap<>();

    /**
     * Rows numbered from 1 in request order.
     */
    public List<RawRow> toRawRows() {
        List<RawRow> raw = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            raw.add(rows.get(i).toRawRow(i + 1));
        }
        return raw;
    }
}
