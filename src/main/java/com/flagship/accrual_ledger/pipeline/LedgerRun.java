package com.flagship.accrual_ledger.pipeline;

import com.flagship.accrual_ledger.ledger.Transaction;
import com.flagship.accrual_ledger.tax.TaxState;
import lombok.Value;

import java.util.List;

/**
 * Result of one pipeline run.
 *
 * An aborted run carries no transactions: nothing from a run that hit an integrity
 * failure is handed downstream.
 */
@Value
public class LedgerRun {
    String runId;
    RunOutcome outcome;
    List<Transaction> transactions;
    List<LedgerWarning> warnings;
    String abortReason;
    TaxState finalTaxState;
    long accrualClearingBalance;

    public boolean isAborted() {
        return outcome == RunOutcome.ABORTED;
    }
}
