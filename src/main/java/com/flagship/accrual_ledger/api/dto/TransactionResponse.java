package com.flagship.accrual_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.accrual_ledger.classify.EventType;
import com.flagship.accrual_ledger.event.CurrencyCode;
import com.flagship.accrual_ledger.ledger.Transaction;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

@Value
@Builder
public class TransactionResponse {

    @JsonProperty("event_id")
    String eventId;

    @JsonProperty("event_type")
    EventType eventType;

    @JsonProperty("date")
    LocalDate date;

    @JsonProperty("timestamp")
    Instant timestamp;

    @JsonProperty("description")
    String description;

    @JsonProperty("currency")
    CurrencyCode currency;

    @JsonProperty("splits")
    List<SplitResponse> splits;

    public static TransactionResponse from(Transaction transaction) {
        return TransactionResponse.builder()
            .eventId(transaction.getEventId())
            .eventType(transaction.getEventType())
            .date(transaction.getDate())
            .timestamp(transaction.getTimestamp())
            .description(transaction.getDescription())
            .currency(transaction.getCurrency())
            .splits(transaction.getSplits().stream().map(SplitResponse::from).toList())
            .build();
    }
}
