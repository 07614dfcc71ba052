package com.flagship.medici_ledger.ledger.exception;

/**
 * Thrown when an import file as a whole has the wrong shape, e.g. a JSON document
 * that is not an array. Unlike record-level errors this aborts the import.
 */
public class MalformedDocumentException extends LedgerException {

    public MalformedDocumentException(String message) {
        super(message);
    }
}
