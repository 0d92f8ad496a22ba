package com.flagship.accrual_ledger.accrual;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Posted charges of one run, stored in an arena and indexed by correlation key.
 *
 * Reversals look their charge up by key instead of matching rows by type or description.
 * Also tracks how much reserved withholding payouts have already funded. Only committed
 * transactions register here.
 */
@Slf4j
public class ChargeRegistry {

    private final List<PostedCharge> arena = new ArrayList<>();
    private final Map<String, Integer> byCorrelationKey = new HashMap<>();
    private final Map<String, Long> withholdingFunded = new HashMap<>();

    void register(PostedCharge charge) {
        arena.add(charge);
        Integer previous = byCorrelationKey.putIfAbsent(charge.getCorrelationKey(), arena.size() - 1);
        if (previous != null) {
            log.debug("Correlation key already indexed, keeping first charge: key={}, eventId={}",
                    charge.getCorrelationKey(), arena.get(previous).getEventId());
        }
    }

    public Optional<PostedCharge> find(String correlationKey) {
        if (correlationKey == null) {
            return Optional.empty();
        }
        Integer slot = byCorrelationKey.get(correlationKey);
        return slot == null ? Optional.empty() : Optional.of(arena.get(slot));
    }

    /**
     * @throws OrphanRefundException if no charge was posted under the key
     */
    PostedCharge require(String correlationKey, String reversalEventId) {
        return find(correlationKey)
                .orElseThrow(() -> new OrphanRefundException(reversalEventId, correlationKey));
    }

    /**
     * Withholding reserved by posted charges, net of reversals, that no payout has moved to
     * the withholding account yet. Never negative.
     */
    public long outstandingWithholding(String category) {
        long reserved = 0;
        for (PostedCharge charge : arena) {
            reserved = Math.addExact(reserved, charge.reservedWithholding(category));
        }
        return Math.max(0L, reserved - withholdingFunded.getOrDefault(category, 0L));
    }

    void recordWithholdingFunded(Map<String, Long> funded) {
        funded.forEach((category, amount) -> withholdingFunded.merge(category, amount, Math::addExact));
    }

    public int size() {
        return arena.size();
    }
}
