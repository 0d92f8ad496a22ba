package com.flagship.accrual_ledger.ledger;

import com.flagship.accrual_ledger.classify.EventType;
import com.flagship.accrual_ledger.event.CurrencyCode;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * A balanced ledger transaction synthesized from one payment event.
 *
 * Only {@link LedgerAssembler} creates these, so every instance sums to zero and
 * carries its splits in canonical order.
 */
@Value
public class Transaction {
    String eventId;
    EventType eventType;
    LocalDate date;
    Instant timestamp;
    String description;
    CurrencyCode currency;
    List<Split> splits;

    public long sumOfSplits() {
        return splits.stream().mapToLong(Split::getAmount).sum();
    }

    /**
     * Net signed amount this transaction posts to the given account.
     */
    public long netFor(String accountIdentifier) {
        return splits.stream()
                .filter(s -> s.getAccountIdentifier().equals(accountIdentifier))
                .mapToLong(Split::getAmount)
                .sum();
    }

    public boolean touches(String accountIdentifier) {
        return splits.stream().anyMatch(s -> s.getAccountIdentifier().equals(accountIdentifier));
    }
}
