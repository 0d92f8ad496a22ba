package com.flagship.accrual_ledger.pipeline;

import com.flagship.accrual_ledger.accrual.AccrualSplitter;
import com.flagship.accrual_ledger.accrual.ChargeRegistry;
import com.flagship.accrual_ledger.accrual.ExcessReversalException;
import com.flagship.accrual_ledger.accrual.OrphanRefundException;
import com.flagship.accrual_ledger.accrual.SplitPlan;
import com.flagship.accrual_ledger.classify.ClassificationSession;
import com.flagship.accrual_ledger.classify.ClassifiedEvent;
import com.flagship.accrual_ledger.classify.EventClassifier;
import com.flagship.accrual_ledger.classify.UnclassifiableEventException;
import com.flagship.accrual_ledger.event.DuplicateRowException;
import com.flagship.accrual_ledger.event.EventNormalizer;
import com.flagship.accrual_ledger.event.MalformedRowException;
import com.flagship.accrual_ledger.event.PaymentEvent;
import com.flagship.accrual_ledger.event.RawRow;
import com.flagship.accrual_ledger.event.UnknownCurrencyException;
import com.flagship.accrual_ledger.exception.LedgerException;
import com.flagship.accrual_ledger.ledger.AccountMapping;
import com.flagship.accrual_ledger.ledger.AccountRole;
import com.flagship.accrual_ledger.ledger.LedgerAssembler;
import com.flagship.accrual_ledger.ledger.LedgerBalances;
import com.flagship.accrual_ledger.ledger.Transaction;
import com.flagship.accrual_ledger.ledger.UnbalancedTransactionException;
import com.flagship.accrual_ledger.observability.LedgerMetrics;
import com.flagship.accrual_ledger.tax.ChronologyViolationException;
import com.flagship.accrual_ledger.tax.TaxState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Drives one run from raw rows to transactions.
 *
 * Key principles:
 * - Single pass in chronological order; ties keep their input order
 * - Row and event failures are collected as warnings and the run continues
 * - A repeated event id is posted once; later rows with that id are skipped
 * - An unbalanced transaction or a chronology violation aborts the whole run
 * - Run state (tax totals, posted charges) is committed only after a transaction assembles
 *
 * The service itself is stateless; every run owns its state, so concurrent requests
 * never share running totals.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerPipeline {

    private final EventNormalizer normalizer;
    private final EventClassifier classifier;
    private final AccrualSplitter splitter;
    private final LedgerAssembler assembler;
    private final AccountMapping accounts;
    private final LedgerMetrics metrics;

    public LedgerRun run(List<RawRow> rows) {
        return run(rows, TaxState.initial());
    }

    /**
     * Synthesizes transactions for the given rows.
     *
     * @param rows         raw rows from an import adapter, in chronological order
     * @param initialState tax running totals carried over from earlier runs
     * @return the run result; never throws for row- or event-scoped failures
     */
    public LedgerRun run(List<RawRow> rows, TaxState initialState) {
        long startTime = System.currentTimeMillis();
        String runId = UUID.randomUUID().toString().substring(0, 8);
        MDC.put("runId", runId);
        metrics.recordRowsReceived(rows.size());
        log.info("Starting ledger run: rows={}", rows.size());

        List<LedgerWarning> warnings = new ArrayList<>();
        try {
            List<PaymentEvent> events = normalize(rows, warnings);
            List<ClassifiedEvent> classified = classify(events, warnings);
            LedgerRun result = synthesize(runId, classified, initialState, warnings);
            finish(result, startTime);
            return result;
        } finally {
            MDC.remove("runId");
        }
    }

    private List<PaymentEvent> normalize(List<RawRow> rows, List<LedgerWarning> warnings) {
        List<PaymentEvent> events = new ArrayList<>(rows.size());
        Map<String, Long> firstLineById = new HashMap<>();
        for (RawRow row : rows) {
            try {
                PaymentEvent event = normalizer.normalize(row);
                Long firstLine = firstLineById.putIfAbsent(event.getId(), event.getLineNumber());
                if (firstLine == null) {
                    events.add(event);
                } else {
                    warn(warnings, WarningKind.DUPLICATE_ROW, event.getId(), row.getLineNumber(),
                            new DuplicateRowException(event.getId(), event.getLineNumber(), firstLine));
                }
            } catch (MalformedRowException e) {
                warn(warnings, WarningKind.MALFORMED_ROW, null, row.getLineNumber(), e);
            } catch (UnknownCurrencyException e) {
                warn(warnings, WarningKind.UNKNOWN_CURRENCY, null, row.getLineNumber(), e);
            }
        }
        // List.sort is stable: rows with equal timestamps keep their input order
        events.sort(Comparator.comparing(PaymentEvent::getTimestamp));
        return events;
    }

    private List<ClassifiedEvent> classify(List<PaymentEvent> events, List<LedgerWarning> warnings) {
        ClassificationSession session = classifier.newSession();
        for (PaymentEvent event : events) {
            try {
                session.accept(event);
            } catch (UnclassifiableEventException e) {
                warn(warnings, WarningKind.UNCLASSIFIABLE_EVENT, event.getId(), event.getLineNumber(), e);
            }
        }
        List<ClassifiedEvent> classified = session.finish();
        classified.forEach(c -> metrics.recordEventClassified(c.getType().name()));
        return classified;
    }

    private LedgerRun synthesize(String runId, List<ClassifiedEvent> classified, TaxState initialState,
                                 List<LedgerWarning> warnings) {
        String clearing = accounts.get(AccountRole.ACCRUAL_CLEARING).getIdentifier();
        TaxState taxState = initialState;
        ChargeRegistry charges = new ChargeRegistry();
        LedgerBalances balances = new LedgerBalances();
        List<Transaction> transactions = new ArrayList<>(classified.size());

        for (ClassifiedEvent item : classified) {
            PaymentEvent event = item.getEvent();
            MDC.put("eventId", event.getId());
            try {
                SplitPlan plan = splitter.plan(item, taxState, charges);
                Transaction transaction = assembler.assemble(event, item.getType(), plan.getDescription(),
                        plan.getSplits());

                taxState = plan.getNextTaxState();
                plan.commitTo(charges);
                long clearingBefore = balances.balanceOf(clearing);
                balances.apply(transaction);
                transactions.add(transaction);
                metrics.recordTransactionEmitted(item.getType().name());
                log.debug("Emitted transaction: type={}, splits={}", item.getType(), transaction.getSplits().size());

                for (LedgerException degradation : plan.getDegradations()) {
                    warn(warnings, kindOf(degradation), event.getId(), event.getLineNumber(), degradation);
                }
                long clearingAfter = balances.balanceOf(clearing);
                if (clearingAfter < 0 && clearingAfter < clearingBefore) {
                    warnings.add(new LedgerWarning(WarningKind.NEGATIVE_ACCRUAL_CLEARING, event.getId(),
                            event.getLineNumber(),
                            "Accrual clearing balance is negative (" + clearingAfter
                                    + "): more cash claimed than ever accrued"));
                    metrics.recordWarning(WarningKind.NEGATIVE_ACCRUAL_CLEARING.name());
                    log.warn("Accrual clearing balance went negative: balance={}", clearingAfter);
                }
            } catch (UnbalancedTransactionException | ChronologyViolationException e) {
                log.error("Aborting ledger run, {} transactions discarded: error={}",
                        transactions.size(), e.getMessage());
                return new LedgerRun(runId, RunOutcome.ABORTED, List.of(), List.copyOf(warnings),
                        e.getMessage(), initialState, 0L);
            } finally {
                MDC.remove("eventId");
            }
        }

        RunOutcome outcome = warnings.isEmpty() ? RunOutcome.COMPLETED_CLEAN : RunOutcome.COMPLETED_WITH_WARNINGS;
        return new LedgerRun(runId, outcome, List.copyOf(transactions), List.copyOf(warnings), null,
                taxState, balances.balanceOf(clearing));
    }

    private void finish(LedgerRun result, long startTime) {
        long duration = System.currentTimeMillis() - startTime;
        metrics.recordRun(result.getOutcome().name(), Duration.ofMillis(duration));
        for (LedgerWarning warning : result.getWarnings()) {
            log.info("Run warning: kind={}, eventId={}, line={}, message={}",
                    warning.getKind(), warning.getEventId(), warning.getLineNumber(), warning.getMessage());
        }
        log.info("Ledger run finished: outcome={}, transactions={}, warnings={}, clearingBalance={}, duration={}ms",
                result.getOutcome(), result.getTransactions().size(), result.getWarnings().size(),
                result.getAccrualClearingBalance(), duration);
    }

    private void warn(List<LedgerWarning> warnings, WarningKind kind, String eventId, long line, LedgerException e) {
        log.warn("Collected warning: kind={}, line={}, error={}", kind, line, e.getMessage());
        warnings.add(new LedgerWarning(kind, eventId, line, e.getMessage()));
        metrics.recordWarning(kind.name());
    }

    private static WarningKind kindOf(LedgerException degradation) {
        if (degradation instanceof OrphanRefundException) {
            return WarningKind.ORPHAN_REFUND;
        }
        if (degradation instanceof ExcessReversalException) {
            return WarningKind.EXCESS_REVERSAL;
        }
        throw new IllegalStateException("Unexpected degradation " + degradation.getClass().getSimpleName());
    }
}
