package com.flagship.medici_ledger.ledger.exception;

/**
 * Thrown when a total or an account balance would not fit in the cent range of
 * {@link com.flagship.medici_ledger.ledger.Money}. Nothing has been posted when it is raised.
 */
public class AmountOutOfRangeException extends LedgerException {

    public AmountOutOfRangeException(String message, Throwable cause) {
        super(message, cause);
    }
}
