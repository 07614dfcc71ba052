package com.flagship.medici_ledger.ledger;

import lombok.Value;

import java.util.Objects;

/**
 * A single debit or credit line of a transaction.
 * The side is implied by the list the entry is filed in, so the amount is never negative.
 */
@Value
public class TransactionEntry {
    Account account;
    Money amount;

    private TransactionEntry(Account account, Money amount) {
        this.account = Objects.requireNonNull(account, "account");
        this.amount = Objects.requireNonNull(amount, "amount");
        if (amount.isNegative()) {
            throw new IllegalArgumentException("Entry amount must not be negative: " + amount);
        }
    }

    public static TransactionEntry of(Account account, Money amount) {
        return new TransactionEntry(account, amount);
    }

    @Override
    public String toString() {
        return account.getName() + ": " + amount;
    }
}
