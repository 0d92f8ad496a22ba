package com.flagship.accrual_ledger.classify;

import com.flagship.accrual_ledger.exception.LedgerException;
import lombok.Getter;

/**
 * No classification rule matched the event. Scope: one event.
 */
@Getter
public class UnclassifiableEventException extends LedgerException {

    private final String eventId;

    public UnclassifiableEventException(String eventId, String message) {
        super(String.format("Event %s cannot be classified: %s", eventId, message));
        this.eventId = eventId;
    }
}
