package com.flagship.accrual_ledger.ledger;

import com.flagship.accrual_ledger.ledger.Account.AccountType;

/**
 * Fixed posting roles the splitter writes to. Tax categories get their own
 * expense/liability pair on top of these.
 */
public enum AccountRole {
    REVENUE(AccountType.REVENUE),
    INVOICE_REVENUE(AccountType.REVENUE),
    ACCRUAL_CLEARING(AccountType.ASSET),
    PROCESSING_FEE_EXPENSE(AccountType.EXPENSE),
    BILLING_FEE_EXPENSE(AccountType.EXPENSE),
    BANK(AccountType.ASSET),
    UNMATCHED_REVERSAL(AccountType.LIABILITY),
    TAX_ROUNDING_EXPENSE(AccountType.EXPENSE),
    TAX_ROUNDING_LIABILITY(AccountType.LIABILITY);

    private final AccountType accountType;

    AccountRole(AccountType accountType) {
        this.accountType = accountType;
    }

    public AccountType getAccountType() {
        return accountType;
    }
}
