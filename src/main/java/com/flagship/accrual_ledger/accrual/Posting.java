package com.flagship.accrual_ledger.accrual;

import com.flagship.accrual_ledger.ledger.Account;
import com.flagship.accrual_ledger.ledger.Split;
import lombok.Value;

import java.util.List;

/**
 * A balanced debit/credit pair of one amount. Every component of a charge is one posting,
 * which keeps scaled reversals balanced leg for leg.
 */
@Value
public class Posting {
    Account debitAccount;
    String debitMemo;
    Account creditAccount;
    String creditMemo;
    long amount;

    public List<Split> toSplits() {
        return List.of(
                Split.debit(debitAccount, amount, debitMemo),
                Split.credit(creditAccount, amount, creditMemo));
    }

    /**
     * The mirror posting of {@code reversedAmount}: credits what this posting debited and
     * debits what it credited.
     */
    public Posting reversed(long reversedAmount, String memoPrefix) {
        return new Posting(creditAccount, memoPrefix + creditMemo, debitAccount, memoPrefix + debitMemo,
                reversedAmount);
    }
}
