package com.flagship.medici_ledger.ledger.exception;

/**
 * Base type for ledger rule violations and rejected import records.
 */
public class LedgerException extends RuntimeException {

    public LedgerException(String message) {
        super(message);
    }

    public LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
