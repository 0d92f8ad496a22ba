package com.flagship.accrual_ledger.pipeline;

/**
 * How a run ended, with the process exit code each outcome maps to.
 */
public enum RunOutcome {
    COMPLETED_CLEAN(0),
    COMPLETED_WITH_WARNINGS(1),
    ABORTED(2);

    private final int exitCode;

    RunOutcome(int exitCode) {
        this.exitCode = exitCode;
    }

    public int getExitCode() {
        return exitCode;
    }
}
