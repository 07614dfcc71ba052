package com.flagship.medici_ledger.ledger;

/**
 * The five account categories of double-entry accounting.
 *
 * Debits increase ASSET and EXPENSE accounts.
 * Credits increase LIABILITY, EQUITY and REVENUE accounts.
 */
public enum AccountType {
    ASSET,
    LIABILITY,
    EQUITY,
    REVENUE,
    EXPENSE;

    /**
     * Multiplier applied to an amount when it is debited to an account of this type.
     * A credit uses the opposite sign.
     */
    public int debitSign() {
        return switch (this) {
            case ASSET, EXPENSE -> 1;
            case LIABILITY, EQUITY, REVENUE -> -1;
        };
    }

    /**
     * True when a positive balance sits on the debit side.
     */
    public boolean isDebitNormal() {
        return debitSign() > 0;
    }
}
