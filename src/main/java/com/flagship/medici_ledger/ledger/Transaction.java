package com.flagship.medici_ledger.ledger;

import com.flagship.medici_ledger.ledger.exception.AmountOutOfRangeException;
import com.flagship.medici_ledger.ledger.exception.UnbalancedTransactionException;
import lombok.Getter;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An atomic group of debit and credit entries.
 *
 * Key invariant: sum of debits must equal sum of credits, checked exactly
 * before anything is posted. Entries are append-only and the transaction
 * can be posted once; after that it is frozen.
 */
public class Transaction {

    @Getter
    private final LocalDate date;
    @Getter
    private final String description;
    private final List<TransactionEntry> debits = new ArrayList<>();
    private final List<TransactionEntry> credits = new ArrayList<>();
    private boolean posted;

    public Transaction(LocalDate date, String description) {
        this.date = Objects.requireNonNull(date, "date");
        this.description = description == null ? "" : description;
    }

    public void addDebit(TransactionEntry entry) {
        ensureNotPosted();
        debits.add(Objects.requireNonNull(entry));
    }

    public void addCredit(TransactionEntry entry) {
        ensureNotPosted();
        credits.add(Objects.requireNonNull(entry));
    }

    public List<TransactionEntry> getDebits() {
        return Collections.unmodifiableList(debits);
    }

    public List<TransactionEntry> getCredits() {
        return Collections.unmodifiableList(credits);
    }

    public Money getDebitTotal() {
        return total(debits);
    }

    public Money getCreditTotal() {
        return total(credits);
    }

    public boolean isBalanced() {
        return getDebitTotal().equals(getCreditTotal());
    }

    public boolean isPosted() {
        return posted;
    }

    /**
     * Checks the transaction can be posted.
     *
     * @throws UnbalancedTransactionException if a side is empty or the totals differ
     * @throws AmountOutOfRangeException if a side's total does not fit in the cent range
     */
    public void validate() {
        if (debits.isEmpty() || credits.isEmpty()) {
            throw new UnbalancedTransactionException(
                String.format("Transaction needs at least one debit and one credit: debits=%d, credits=%d",
                    debits.size(), credits.size()),
                getDebitTotal(), getCreditTotal());
        }
        if (!isBalanced()) {
            throw new UnbalancedTransactionException(getDebitTotal(), getCreditTotal());
        }
    }

    /**
     * Applies every debit, then every credit, in entry order.
     * Only the ledger calls this, and only after {@link #validate()} passed.
     *
     * @throws AmountOutOfRangeException if a resulting balance would overflow; no balance is touched
     */
    void post() {
        ensureNotPosted();
        if (!isBalanced()) {
            throw new IllegalStateException("Refusing to post an unbalanced transaction: " + description);
        }
        checkResultingBalances();
        for (TransactionEntry entry : debits) {
            entry.getAccount().debit(entry.getAmount());
        }
        for (TransactionEntry entry : credits) {
            entry.getAccount().credit(entry.getAmount());
        }
        posted = true;
    }

    private void checkResultingBalances() {
        Map<Account, Money> projected = new IdentityHashMap<>();
        try {
            for (TransactionEntry entry : debits) {
                Account account = entry.getAccount();
                Money from = projected.getOrDefault(account, account.getBalance());
                projected.put(account, account.afterDebit(from, entry.getAmount()));
            }
            for (TransactionEntry entry : credits) {
                Account account = entry.getAccount();
                Money from = projected.getOrDefault(account, account.getBalance());
                projected.put(account, account.afterCredit(from, entry.getAmount()));
            }
        } catch (ArithmeticException e) {
            throw new AmountOutOfRangeException(
                "Posting '" + description + "' would overflow an account balance", e);
        }
    }

    private void ensureNotPosted() {
        if (posted) {
            throw new IllegalStateException("Transaction already posted: " + description);
        }
    }

    private Money total(List<TransactionEntry> entries) {
        try {
            return entries.stream()
                .map(TransactionEntry::getAmount)
                .reduce(Money.ZERO, Money::plus);
        } catch (ArithmeticException e) {
            throw new AmountOutOfRangeException(
                "Entry total of '" + description + "' is out of range", e);
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Transaction: ").append(date).append(" - ").append(description);
        sb.append(System.lineSeparator()).append("  Debits:");
        for (TransactionEntry entry : debits) {
            sb.append(System.lineSeparator()).append("    ").append(entry);
        }
        sb.append(System.lineSeparator()).append("  Credits:");
        for (TransactionEntry entry : credits) {
            sb.append(System.lineSeparator()).append("    ").append(entry);
        }
        return sb.toString();
    }
}
