package com.flagship.accrual_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.accrual_ledger.ledger.Account.AccountType;
import com.flagship.accrual_ledger.ledger.EntryType;
import com.flagship.accrual_ledger.ledger.Split;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SplitResponse {

    @JsonProperty("account")
    String account;

    @JsonProperty("account_type")
    AccountType accountType;

    @JsonProperty("entry_type")
    EntryType entryType;

    /** Signed minor units, positive = debit. */
    @JsonProperty("amount")
    long amount;

    @JsonProperty("memo")
    String memo;

    public static SplitResponse from(Split split) {
        return SplitResponse.builder()
            .account(split.getAccountIdentifier())
            .accountType(split.getAccount().getType())
            .entryType(split.getEntryType())
            .amount(split.getAmount())
            .memo(split.getMemo())
            .build();
    }
}
