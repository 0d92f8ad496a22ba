package com.flagship.accrual_ledger.event;

/**
 * How the raw grossAmount field is written by the import adapter.
 */
public enum AmountFormat {
    /** Decimal major units, e.g. "100.00" (Stripe CSV exports). */
    MAJOR_UNITS,
    /** Integer minor units, e.g. "10000" (Stripe API objects). */
    MINOR_UNITS
}
