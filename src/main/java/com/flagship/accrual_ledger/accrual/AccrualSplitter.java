package com.flagship.accrual_ledger.accrual;

import com.flagship.accrual_ledger.classify.ChargeEvent;
import com.flagship.accrual_ledger.classify.ClassifiedEvent;
import com.flagship.accrual_ledger.classify.EventType;
import com.flagship.accrual_ledger.classify.FeeEvent;
import com.flagship.accrual_ledger.classify.IncomeCategory;
import com.flagship.accrual_ledger.classify.PayoutEvent;
import com.flagship.accrual_ledger.classify.ReversalEvent;
import com.flagship.accrual_ledger.event.PaymentEvent;
import com.flagship.accrual_ledger.exception.LedgerException;
import com.flagship.accrual_ledger.ledger.Account;
import com.flagship.accrual_ledger.ledger.AccountMapping;
import com.flagship.accrual_ledger.ledger.AccountRole;
import com.flagship.accrual_ledger.ledger.Split;
import com.flagship.accrual_ledger.tax.TaxAssessment;
import com.flagship.accrual_ledger.tax.TaxEngine;
import com.flagship.accrual_ledger.tax.TaxState;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Produces the signed account postings for each classified event on an accrual basis.
 *
 * Revenue is recognized at charge time against the Accrual-Clearing account; payouts
 * move the cleared amount to the bank. Tax withholding is reserved at charge time and
 * processing fees are booked as separate expense. When withholding accounts are
 * configured, each payout also funds them with the withholding reserved so far.
 *
 * Stateless: run state (tax totals, posted charges) is passed in and the resulting
 * changes are returned inside the {@link SplitPlan}.
 */
@Slf4j
public class AccrualSplitter {

    private static final String REVERSAL_MEMO_PREFIX = "Reversal: ";

    private final AccountMapping accounts;
    private final TaxEngine taxEngine;

    public AccrualSplitter(AccountMapping accounts, TaxEngine taxEngine) {
        this.accounts = accounts;
        this.taxEngine = taxEngine;
    }

    /**
     * Plans the splits for one event.
     *
     * @param event    classified event, fed in chronological order
     * @param taxState tax running totals before this event
     * @param charges  charges already posted in this run
     * @return splits plus the state changes to commit once they are assembled
     */
    public SplitPlan plan(ClassifiedEvent event, TaxState taxState, ChargeRegistry charges) {
        return event.accept(new ClassifiedEvent.Handler<>() {
            @Override
            public SplitPlan onCharge(ChargeEvent charge) {
                return planCharge(charge, taxState);
            }

            @Override
            public SplitPlan onPayout(PayoutEvent payout) {
                return planPayout(payout, taxState, charges);
            }

            @Override
            public SplitPlan onFee(FeeEvent fee) {
                return planFee(fee, taxState);
            }

            @Override
            public SplitPlan onReversal(ReversalEvent reversal) {
                return planReversal(reversal, taxState, charges);
            }
        });
    }

    SplitPlan planCharge(ChargeEvent charge, TaxState taxState) {
        PaymentEvent event = charge.getEvent();
        long gross = charge.getGross();
        Account clearing = accounts.get(AccountRole.ACCRUAL_CLEARING);
        Account revenue = charge.getIncomeCategory() == IncomeCategory.INVOICE
                ? accounts.get(AccountRole.INVOICE_REVENUE)
                : accounts.get(AccountRole.REVENUE);

        List<Posting> postings = new ArrayList<>();
        postings.add(new Posting(clearing, "Gross to processor balance",
                revenue, describeOr(event, "Revenue"), gross));

        TaxAssessment assessment = taxEngine.assess(gross, event.getTimestamp(), taxState);
        Map<String, Integer> withholdingPostings = new LinkedHashMap<>();
        for (Map.Entry<String, Long> entry : assessment.getWithheld().entrySet()) {
            String category = entry.getKey();
            withholdingPostings.put(category, postings.size());
            postings.add(new Posting(accounts.taxExpense(category), category + " expense",
                    accounts.taxLiability(category), category + " liability", entry.getValue()));
        }
        if (assessment.getRoundingRemainder() != 0) {
            postings.add(new Posting(accounts.get(AccountRole.TAX_ROUNDING_EXPENSE), "Tax rounding adjustment",
                    accounts.get(AccountRole.TAX_ROUNDING_LIABILITY), "Tax rounding adjustment",
                    assessment.getRoundingRemainder()));
        }
        if (charge.hasFee()) {
            postings.add(new Posting(accounts.get(AccountRole.PROCESSING_FEE_EXPENSE), "Processing fee",
                    clearing, "Processing fee", charge.getFee()));
        }

        PostedCharge posted = new PostedCharge(event.getId(), charge.getCorrelationKey(), event.getTimestamp(),
                gross, postings, withholdingPostings);
        String label = charge.getIncomeCategory() == IncomeCategory.INVOICE ? "Invoice" : "Subscription";
        return new SplitPlan(charge, label + ": " + describeOr(event, "Revenue"), expand(postings),
                assessment.getNextState(), posted, null, List.of());
    }

    SplitPlan planPayout(PayoutEvent payout, TaxState taxState, ChargeRegistry charges) {
        PaymentEvent event = payout.getEvent();
        Account bank = accounts.get(AccountRole.BANK);
        List<Posting> postings = new ArrayList<>();
        postings.add(new Posting(bank, "Payout to bank",
                accounts.get(AccountRole.ACCRUAL_CLEARING), "Payout to bank", payout.getNetAmount()));

        // the bank keeps what is left after funding the withholding accounts
        Map<String, Long> funded = new LinkedHashMap<>();
        long available = payout.getNetAmount();
        for (String category : accounts.getWithholdingCategories()) {
            long amount = Math.min(charges.outstandingWithholding(category), available);
            if (amount <= 0) {
                continue;
            }
            Account withholding = accounts.withholding(category).orElseThrow();
            postings.add(new Posting(withholding, category + " withholding",
                    bank, category + " withholding", amount));
            funded.put(category, amount);
            available -= amount;
        }
        if (!funded.isEmpty()) {
            log.debug("Payout funds withholding: eventId={}, funded={}, toOperating={}",
                    event.getId(), funded, available);
        }
        return new SplitPlan(payout, describe("Payout", event), expand(postings),
                taxState, null, null, List.of(), Map.copyOf(funded));
    }

    SplitPlan planFee(FeeEvent fee, TaxState taxState) {
        PaymentEvent event = fee.getEvent();
        Posting posting = new Posting(accounts.get(AccountRole.BILLING_FEE_EXPENSE), describeOr(event, "Billing fee"),
                accounts.get(AccountRole.ACCRUAL_CLEARING), "Billing fee", fee.getAmount());
        return new SplitPlan(fee, describe("Billing fee", event), posting.toSplits(),
                taxState, null, null, List.of());
    }

    SplitPlan planReversal(ReversalEvent reversal, TaxState taxState, ChargeRegistry charges) {
        PaymentEvent event = reversal.getEvent();
        String description = describe(label(reversal.getType()), event);
        long amount = reversal.getAmount();

        if (!event.isNegative() && reversal.getType() == EventType.ADJUSTMENT) {
            // money coming back into the balance has no charge postings to mirror
            log.info("Adjustment credits the processor balance, posting standalone: eventId={}, amount={}",
                    event.getId(), amount);
            List<LedgerException> degradations = charges.find(reversal.getCorrelationId()).isPresent()
                    ? List.of()
                    : List.of(new OrphanRefundException(event.getId(), reversal.getCorrelationId()));
            return new SplitPlan(reversal, description, standalone(event, amount, false).toSplits(),
                    taxState, null, null, degradations);
        }
        if (!event.isNegative()) {
            log.info("{} row carries a positive amount, reversing by magnitude: eventId={}, amount={}",
                    reversal.getType(), event.getId(), amount);
        }

        PostedCharge charge;
        try {
            charge = charges.require(reversal.getCorrelationId(), event.getId());
        } catch (OrphanRefundException e) {
            log.warn("Degrading to standalone reversal: eventId={}, reason={}", event.getId(), e.getMessage());
            return new SplitPlan(reversal, description, standalone(event, amount, true).toSplits(),
                    taxState, null, null, List.of(e));
        }

        List<LedgerException> degradations = new ArrayList<>();
        long remaining = charge.remainingGross();
        long linked = Math.min(amount, remaining);
        long excess = amount - linked;
        if (excess > 0) {
            ExcessReversalException e = new ExcessReversalException(event.getId(), charge.getEventId(),
                    amount, remaining);
            log.warn("Reversal exceeds remaining charge amount: {}", e.getMessage());
            degradations.add(e);
        }

        List<Posting> charged = charge.getPostings();
        long[] perPosting = new long[charged.size()];
        List<Posting> mirrored = new ArrayList<>();
        for (int i = 0; i < charged.size(); i++) {
            Posting original = charged.get(i);
            perPosting[i] = linked == remaining
                    ? original.getAmount() - charge.reversedOf(i)
                    : Math.multiplyExact(original.getAmount(), linked) / charge.getGross();
            mirrored.add(original.reversed(perPosting[i], REVERSAL_MEMO_PREFIX));
        }
        if (excess > 0) {
            mirrored.add(standalone(event, excess, true));
        }

        TaxState next = taxEngine.reverse(linked, charge.getChargedAt(), event.getTimestamp(), taxState);
        log.debug("Reversal linked to charge: eventId={}, chargeEventId={}, linked={}, excess={}",
                event.getId(), charge.getEventId(), linked, excess);
        return new SplitPlan(reversal, description, expand(mirrored), next, null,
                new SplitPlan.Reversal(charge, linked, perPosting), List.copyOf(degradations));
    }

    /**
     * Reversal against the generic liability account. Money leaving the processor balance
     * debits the liability; money coming in credits it.
     */
    private Posting standalone(PaymentEvent event, long amount, boolean outflow) {
        Account unmatched = accounts.get(AccountRole.UNMATCHED_REVERSAL);
        Account clearing = accounts.get(AccountRole.ACCRUAL_CLEARING);
        String memo = "Unmatched reversal " + event.getId();
        return outflow
                ? new Posting(unmatched, memo, clearing, memo, amount)
                : new Posting(clearing, memo, unmatched, memo, amount);
    }

    private static List<Split> expand(List<Posting> postings) {
        List<Split> splits = new ArrayList<>(postings.size() * 2);
        for (Posting posting : postings) {
            splits.addAll(posting.toSplits());
        }
        return splits;
    }

    private static String label(EventType type) {
        String name = type.name().toLowerCase(Locale.ROOT);
        return Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }

    private static String describe(String label, PaymentEvent event) {
        return event.getDescription().isEmpty() ? label : label + ": " + event.getDescription();
    }

    private static String describeOr(PaymentEvent event, String fallback) {
        return event.getDescription().isEmpty() ? fallback : event.getDescription();
    }
}
