package com.flagship.accrual_ledger.accrual;

import lombok.AccessLevel;
import lombok.Getter;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A charge whose transaction has been emitted, with what has been reversed of it so far.
 */
@Getter
public class PostedCharge {

    private final String eventId;
    private final String correlationKey;
    private final Instant chargedAt;
    private final long gross;
    private final List<Posting> postings;
    /** Tax category to the index of its withholding posting in {@link #postings}. */
    @Getter(AccessLevel.NONE)
    private final Map<String, Integer> withholdingPostings;
    @Getter(AccessLevel.NONE)
    private final long[] reversedPerPosting;
    private long reversedGross;

    PostedCharge(String eventId, String correlationKey, Instant chargedAt, long gross, List<Posting> postings,
                 Map<String, Integer> withholdingPostings) {
        this.eventId = eventId;
        this.correlationKey = correlationKey;
        this.chargedAt = chargedAt;
        this.gross = gross;
        this.postings = List.copyOf(postings);
        this.withholdingPostings = Map.copyOf(withholdingPostings);
        this.reversedPerPosting = new long[postings.size()];
    }

    public long remainingGross() {
        return gross - reversedGross;
    }

    public long reversedOf(int postingIndex) {
        return reversedPerPosting[postingIndex];
    }

    /**
     * Withholding still reserved for {@code category} after reversals.
     */
    public long reservedWithholding(String category) {
        Integer index = withholdingPostings.get(category);
        if (index == null) {
            return 0L;
        }
        return postings.get(index).getAmount() - reversedPerPosting[index];
    }

    void applyReversal(long grossAmount, long[] perPosting) {
        if (perPosting.length != reversedPerPosting.length) {
            throw new IllegalArgumentException("Reversal does not match postings of charge " + eventId);
        }
        reversedGross = Math.addExact(reversedGross, grossAmount);
        for (int i = 0; i < perPosting.length; i++) {
            reversedPerPosting[i] = Math.addExact(reversedPerPosting[i], perPosting[i]);
        }
    }
}
