package com.flagship.accrual_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.accrual_ledger.pipeline.LedgerRun;
import com.flagship.accrual_ledger.pipeline.RunOutcome;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Response DTO for one ledger run.
 */
@Value
@Builder
public class RunResponse {

    @JsonProperty("run_id")
    String runId;

    @JsonProperty("outcome")
    RunOutcome outcome;

    @JsonProperty("exit_code")
    int exitCode;

    @JsonProperty("abort_reason")
    String abortReason;

    @JsonProperty("transactions")
    List<TransactionResponse> transactions;

    @JsonProperty("warnings")
    List<WarningResponse> warnings;

    @JsonProperty("accrual_clearing_balance")
    long accrualClearingBalance;

    /** Income per tax year after the run, to seed the next one. */
    @JsonProperty("year_to_date")
    Map<Integer, Long> yearToDate;

    public static RunResponse from(LedgerRun run) {
        return RunResponse.builder()
            .runId(run.getRunId())
            .outcome(run.getOutcome())
            .exitCode(run.getOutcome().getExitCode())
            .abortReason(run.getAbortReason())
            .transactions(run.getTransactions().stream().map(TransactionResponse::from).toList())
            .warnings(run.getWarnings().stream().map(WarningResponse::from).toList())
            .accrualClearingBalance(run.getAccrualClearingBalance())
            .yearToDate(run.getFinalTaxState().asMap())
            .build();
    }
}
