package com.flagship.accrual_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.accrual_ledger.pipeline.LedgerWarning;
import com.flagship.accrual_ledger.pipeline.WarningKind;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class WarningResponse {

    @JsonProperty("kind")
    WarningKind kind;

    @JsonProperty("event_id")
    String eventId;

    @JsonProperty("line_number")
    long lineNumber;

    @JsonProperty("message")
    String message;

    public static WarningResponse from(LedgerWarning warning) {
        return WarningResponse.builder()
            .kind(warning.getKind())
            .eventId(warning.getEventId())
            .lineNumber(warning.getLineNumber())
            .message(warning.getMessage())
            .build();
    }
}
