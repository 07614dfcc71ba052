package com.flagship.medici_ledger.ledger.exception;

import lombok.Getter;

/**
 * Thrown when an imported entry names an account type outside the five known categories.
 */
@Getter
public class UnknownAccountTypeException extends LedgerException {

    private final String accountType;

    public UnknownAccountTypeException(String accountType) {
        super("Unknown account type: " + accountType);
        this.accountType = accountType;
    }
}
