package com.flagship.accrual_ledger.ledger;

import lombok.Value;

/**
 * An account in the destination ledger, identified by its full name
 * (e.g. "Assets:Stripe Balance").
 */
@Value
public class Account {
    String identifier;
    AccountType type;

    public enum AccountType {
        ASSET,
        LIABILITY,
        EQUITY,
        REVENUE,
        EXPENSE
    }
}
