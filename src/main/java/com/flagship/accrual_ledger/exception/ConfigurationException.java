package com.flagship.accrual_ledger.exception;

/**
 * Raised while binding the account mapping or tax table.
 * Fatal at startup, before any event is processed.
 */
public class ConfigurationException extends LedgerException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
