package com.flagship.accrual_ledger.ledger;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Per-account running balances derived from transactions.
 *
 * Balances are derived, not stored: replaying the emitted transactions reconstructs
 * every balance, including the Accrual-Clearing balance. Signed like splits, so asset
 * and expense balances are positive and liability and revenue balances negative.
 */
public class LedgerBalances {

    private final Map<String, Long> balances = new TreeMap<>();

    public static LedgerBalances replay(Iterable<Transaction> transactions) {
        LedgerBalances balances = new LedgerBalances();
        for (Transaction transaction : transactions) {
            balances.apply(transaction);
        }
        return balances;
    }

    public void apply(Transaction transaction) {
        for (Split split : transaction.getSplits()) {
            balances.merge(split.getAccountIdentifier(), split.getAmount(), Math::addExact);
        }
    }

    public long balanceOf(String accountIdentifier) {
        return balances.getOrDefault(accountIdentifier, 0L);
    }

    public long balanceOf(Account account) {
        return balanceOf(account.getIdentifier());
    }

    public Map<String, Long> asMap() {
        return Collections.unmodifiableMap(balances);
    }
}
