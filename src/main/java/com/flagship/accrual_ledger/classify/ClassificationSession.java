package com.flagship.accrual_ledger.classify;

import com.flagship.accrual_ledger.event.PaymentEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.flagship.accrual_ledger.classify.EventClassifier.ADJUSTMENT_TYPE;
import static com.flagship.accrual_ledger.classify.EventClassifier.CHARGE_TYPES;
import static com.flagship.accrual_ledger.classify.EventClassifier.DISPUTE_TYPE;
import static com.flagship.accrual_ledger.classify.EventClassifier.FEE_TYPES;
import static com.flagship.accrual_ledger.classify.EventClassifier.PAYOUT_TYPES;
import static com.flagship.accrual_ledger.classify.EventClassifier.REFUND_TYPES;

/**
 * Classifies the events of one run and links fee rows to their charge.
 *
 * Pending charges live in an arena indexed by correlation key. A fee that arrives
 * before its charge is parked and merged when the charge shows up; a fee whose charge
 * never shows up becomes a standalone {@link FeeEvent} in its own chronological slot.
 * Not thread-safe: one session per run.
 */
@Slf4j
public class ClassificationSession {

    private final List<Slot> slots = new ArrayList<>();
    private final List<PendingCharge> charges = new ArrayList<>();
    private final Map<String, Integer> chargeIndex = new HashMap<>();
    private final Map<String, List<Slot>> parkedFees = new HashMap<>();
    private boolean finished;

    ClassificationSession() {
    }

    /**
     * Classifies the next event in chronological order.
     *
     * @throws UnclassifiableEventException if no rule matches; the session stays usable
     */
    public void accept(PaymentEvent event) {
        if (finished) {
            throw new IllegalStateException("Classification session already finished");
        }
        String type = event.getRawType();
        long gross = event.getGrossAmount();

        if (PAYOUT_TYPES.contains(type)) {
            slots.add(Slot.of(new PayoutEvent(event)));
        } else if (CHARGE_TYPES.contains(type) && gross > 0) {
            addCharge(event);
        } else if (REFUND_TYPES.contains(type)) {
            slots.add(Slot.of(new ReversalEvent(event, EventType.REFUND)));
        } else if (FEE_TYPES.contains(type)) {
            addFee(event);
        } else if (ADJUSTMENT_TYPE.equals(type)) {
            slots.add(Slot.of(new ReversalEvent(event, EventType.ADJUSTMENT)));
        } else if (DISPUTE_TYPE.equals(type)) {
            slots.add(Slot.of(new ReversalEvent(event, EventType.DISPUTE)));
        } else if (gross < 0 && referencesCharge(event)) {
            // untyped money leaving the balance against a known charge
            slots.add(Slot.of(new ReversalEvent(event, EventType.REFUND)));
        } else if (CHARGE_TYPES.contains(type)) {
            throw new UnclassifiableEventException(event.getId(),
                    "charge with non-positive amount " + gross + " references no prior charge");
        } else {
            throw new UnclassifiableEventException(event.getId(), "unknown type '" + type + "'");
        }
    }

    /**
     * Closes the session and returns the classified events in input order, with fees merged.
     */
    public List<ClassifiedEvent> finish() {
        finished = true;
        List<ClassifiedEvent> result = new ArrayList<>(slots.size());
        for (Slot slot : slots) {
            if (slot.charge != null) {
                result.add(slot.charge.build());
            } else if (slot.parkedFee != null) {
                if (!slot.merged) {
                    log.debug("Fee has no charge in this run, posting as billing fee: eventId={}, correlationId={}",
                            slot.parkedFee.getId(), slot.parkedFee.getCorrelationId());
                    result.add(new FeeEvent(slot.parkedFee));
                }
            } else {
                result.add(slot.classified);
            }
        }
        return result;
    }

    private boolean referencesCharge(PaymentEvent event) {
        return event.hasCorrelationId() && chargeIndex.containsKey(event.getCorrelationId());
    }

    private void addCharge(PaymentEvent event) {
        String key = event.hasCorrelationId() ? event.getCorrelationId() : event.getId();
        PendingCharge charge = new PendingCharge(event, key);
        charges.add(charge);
        Integer existing = chargeIndex.putIfAbsent(key, charges.size() - 1);
        if (existing != null) {
            log.warn("Duplicate charge for correlationId={}, fees and reversals stay with eventId={}",
                    key, charges.get(existing).event.getId());
        }
        slots.add(Slot.of(charge));

        // fees are only parked while no charge holds the key
        List<Slot> parked = parkedFees.remove(key);
        if (parked != null) {
            for (Slot fee : parked) {
                charge.addFee(fee.parkedFee);
                fee.merged = true;
            }
        }
    }

    private void addFee(PaymentEvent event) {
        if (!event.hasCorrelationId()) {
            slots.add(Slot.of(new FeeEvent(event)));
            return;
        }
        Integer slot = chargeIndex.get(event.getCorrelationId());
        if (slot != null) {
            charges.get(slot).addFee(event);
            return;
        }
        Slot parked = Slot.parked(event);
        slots.add(parked);
        parkedFees.computeIfAbsent(event.getCorrelationId(), k -> new ArrayList<>()).add(parked);
    }

    private static final class PendingCharge {
        private final PaymentEvent event;
        private final String key;
        private final List<String> feeEventIds = new ArrayList<>();
        private long fee;

        private PendingCharge(PaymentEvent event, String key) {
            this.event = event;
            this.key = key;
        }

        private void addFee(PaymentEvent feeEvent) {
            fee = Math.addExact(fee, -feeEvent.getGrossAmount());
            feeEventIds.add(feeEvent.getId());
        }

        private ChargeEvent build() {
            return new ChargeEvent(event, key, fee, List.copyOf(feeEventIds),
                    IncomeCategory.detect(event.getRawType(), event.getDescription()));
        }
    }

    private static final class Slot {
        private ClassifiedEvent classified;
        private PendingCharge charge;
        private PaymentEvent parkedFee;
        private boolean merged;

        private static Slot of(ClassifiedEvent classified) {
            Slot slot = new Slot();
            slot.classified = classified;
            return slot;
        }

        private static Slot of(PendingCharge charge) {
            Slot slot = new Slot();
            slot.charge = charge;
            return slot;
        }

        private static Slot parked(PaymentEvent fee) {
            Slot slot = new Slot();
            slot.parkedFee = fee;
            return slot;
        }
    }
}
