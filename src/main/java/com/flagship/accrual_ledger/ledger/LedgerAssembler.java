package com.flagship.accrual_ledger.ledger;

import com.flagship.accrual_ledger.classify.EventType;
import com.flagship.accrual_ledger.event.PaymentEvent;
import lombok.extern.slf4j.Slf4j;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turns the splits of one event into a transaction.
 *
 * This assembler enforces the core invariants:
 * 1. Debits must equal credits (splits sum to zero in minor units)
 * 2. A transaction is either fully valid or never created
 * 3. Split order is canonical, so identical input yields identical output
 */
@Slf4j
public class LedgerAssembler {

    /**
     * Debits before credits, then account identifier, then memo, then amount.
     */
    static final Comparator<Split> CANONICAL_ORDER = Comparator
            .comparing(Split::getEntryType)
            .thenComparing(Split::getAccountIdentifier)
            .thenComparing(Split::getMemo)
            .thenComparingLong(s -> -Math.abs(s.getAmount()));

    private final ZoneId zone;

    public LedgerAssembler(ZoneId zone) {
        this.zone = zone;
    }

    /**
     * Assembles a transaction for one event.
     *
     * Zero-amount legs are dropped before validation; they carry no information and
     * would only make the output noisier.
     *
     * @param event       the source event
     * @param type        the classified type
     * @param description transaction description
     * @param splits      candidate splits, in any order
     * @return the validated transaction
     * @throws UnbalancedTransactionException if the splits do not sum to zero
     */
    public Transaction assemble(PaymentEvent event, EventType type, String description, List<Split> splits) {
        List<Split> legs = new ArrayList<>(splits.size());
        long sum = 0;
        for (Split split : splits) {
            if (split.getAmount() != 0) {
                legs.add(split);
                sum = Math.addExact(sum, split.getAmount());
            }
        }
        if (sum != 0) {
            throw new UnbalancedTransactionException(event.getId(), sum);
        }
        if (legs.isEmpty()) {
            log.debug("Transaction has no non-zero legs: eventId={}", event.getId());
        }
        legs.sort(CANONICAL_ORDER);

        return new Transaction(
                event.getId(),
                type,
                event.getTimestamp().atZone(zone).toLocalDate(),
                event.getTimestamp(),
                description,
                event.getCurrency(),
                List.copyOf(legs)
        );
    }
}
