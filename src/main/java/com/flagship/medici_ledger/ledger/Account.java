package com.flagship.medici_ledger.ledger;

import lombok.Getter;

/**
 * A named, typed balance holder in the ledger.
 *
 * The balance can only change through {@link #debit(Money)} and {@link #credit(Money)},
 * which are reachable only from {@link Transaction#post()}. Amount validation is the
 * caller's job; the account only applies the sign rule of its type.
 */
@Getter
public class Account {

    private final String name;
    private final AccountType type;
    private Money balance = Money.ZERO;

    Account(String name, AccountType type) {
        this.name = name;
        this.type = type;
    }

    void debit(Money amount) {
        balance = afterDebit(balance, amount);
    }

    void credit(Money amount) {
        balance = afterCredit(balance, amount);
    }

    Money afterDebit(Money from, Money amount) {
        return type.debitSign() > 0 ? from.plus(amount) : from.minus(amount);
    }

    Money afterCredit(Money from, Money amount) {
        return type.debitSign() > 0 ? from.minus(amount) : from.plus(amount);
    }

    /**
     * Balance expressed in the debit-positive convention used by the zero-sum check.
     */
    public Money getDebitNormalizedBalance() {
        return type.isDebitNormal() ? balance : balance.negate();
    }

    @Override
    public String toString() {
        return String.format("%s (%s): %s", name, type, balance);
    }
}
