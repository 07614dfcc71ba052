package com.flagship.medici_ledger.ledger;

import lombok.Value;

import java.util.Objects;

/**
 * A signed amount against one account, as passed to {@link Ledger#recordTransaction}.
 *
 * Positive means "increase this account", negative means "decrease it", whatever the
 * account's type. The ledger turns it into a debit or a credit.
 */
@Value
public class Posting {
    Account account;
    Money amount;

    private Posting(Account account, Money amount) {
        this.account = Objects.requireNonNull(account, "account");
        this.amount = Objects.requireNonNull(amount, "amount");
    }

    public static Posting of(Account account, Money amount) {
        return new Posting(account, amount);
    }

    public static Posting of(Account account, String amount) {
        return new Posting(account, Money.of(amount));
    }

    /**
     * True when this posting lands on the debit side of its account.
     */
    public boolean isDebit() {
        boolean increase = !amount.isNegative();
        return account.getType().isDebitNormal() == increase;
    }

    TransactionEntry toEntry() {
        return TransactionEntry.of(account, amount.abs());
    }
}
