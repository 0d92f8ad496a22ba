package com.flagship.accrual_ledger.ledger;

import lombok.Value;

import java.util.Objects;

/**
 * One signed leg of a double-entry transaction.
 * Positive amounts debit the account, negative amounts credit it.
 */
@Value
public class Split {
    Account account;
    long amount;
    String memo;

    public Split(Account account, long amount, String memo) {
        this.account = Objects.requireNonNull(account);
        this.amount = amount;
        this.memo = memo == null ? "" : memo;
    }

    public static Split debit(Account account, long amount, String memo) {
        return new Split(account, amount, memo);
    }

    public static Split credit(Account account, long amount, String memo) {
        return new Split(account, Math.negateExact(amount), memo);
    }

    public EntryType getEntryType() {
        return amount >= 0 ? EntryType.DEBIT : EntryType.CREDIT;
    }

    public String getAccountIdentifier() {
        return account.getIdentifier();
    }
}
