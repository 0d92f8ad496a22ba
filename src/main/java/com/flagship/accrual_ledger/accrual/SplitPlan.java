package com.flagship.accrual_ledger.accrual;

import com.flagship.accrual_ledger.classify.ClassifiedEvent;
import com.flagship.accrual_ledger.exception.LedgerException;
import com.flagship.accrual_ledger.ledger.Split;
import com.flagship.accrual_ledger.tax.TaxState;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Everything the splitter decided for one event, not yet applied.
 *
 * The pipeline assembles the splits first and only then commits: the tax state is
 * replaced and {@link #commitTo(ChargeRegistry)} records the charge or reversal. An
 * unbalanced transaction therefore leaves no trace in the run state.
 */
@Value
@AllArgsConstructor
public class SplitPlan {
    ClassifiedEvent source;
    String description;
    List<Split> splits;
    TaxState nextTaxState;
    PostedCharge postedCharge;
    Reversal reversal;
    List<LedgerException> degradations;
    /** Tax category to withholding moved from the bank on payout. */
    Map<String, Long> withholdingFunded;

    public SplitPlan(ClassifiedEvent source, String description, List<Split> splits, TaxState nextTaxState,
                     PostedCharge postedCharge, Reversal reversal, List<LedgerException> degradations) {
        this(source, description, splits, nextTaxState, postedCharge, reversal, degradations, Map.of());
    }

    public void commitTo(ChargeRegistry registry) {
        if (postedCharge != null) {
            registry.register(postedCharge);
        }
        if (reversal != null) {
            reversal.getCharge().applyReversal(reversal.getGross(), reversal.getPerPosting());
        }
        if (!withholdingFunded.isEmpty()) {
            registry.recordWithholdingFunded(withholdingFunded);
        }
    }

    /**
     * The part of a reversal that was traced to a posted charge.
     */
    @Value
    public static class Reversal {
        PostedCharge charge;
        long gross;
        long[] perPosting;
    }
}
