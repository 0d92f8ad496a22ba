package com.flagship.accrual_ledger.classify;

import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Ordered rule table mapping raw processor types to accounting event types.
 *
 * The rules themselves are stateless; linking fees and reversals to their charge needs a
 * correlation index, which lives in the per-run {@link ClassificationSession}.
 */
@Component
public class EventClassifier {

    static final Set<String> PAYOUT_TYPES = Set.of("payout", "transfer");
    static final Set<String> CHARGE_TYPES = Set.of("charge", "payment");
    static final Set<String> REFUND_TYPES = Set.of("refund", "payment_refund");
    static final Set<String> FEE_TYPES = Set.of("fee", "stripe_fee");
    static final String ADJUSTMENT_TYPE = "adjustment";
    static final String DISPUTE_TYPE = "dispute";

    /**
     * Starts classifying one run. Events must be fed in chronological order.
     */
    public ClassificationSession newSession() {
        return new ClassificationSession();
    }
}
