package com.flagship.medici_ledger.ledger.exception;

import lombok.Getter;

/**
 * Thrown for an import record with a missing field, an invalid date or a bad amount.
 */
@Getter
public class MalformedRecordException extends LedgerException {

    private final String recordId;

    public MalformedRecordException(String recordId, String message) {
        super(message);
        this.recordId = recordId;
    }

    public MalformedRecordException(String recordId, String message, Throwable cause) {
        super(message, cause);
        this.recordId = recordId;
    }
}
