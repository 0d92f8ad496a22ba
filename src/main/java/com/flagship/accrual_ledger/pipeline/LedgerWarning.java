package com.flagship.accrual_ledger.pipeline;

import lombok.Value;

/**
 * A condition that skipped or degraded one row or event without stopping the run.
 * eventId is null for rows that never became events.
 */
@Value
public class LedgerWarning {
    WarningKind kind;
    String eventId;
    long lineNumber;
    String message;
}
