package com.flagship.medici_ledger.ledger;

import com.flagship.medici_ledger.ledger.exception.AmountOutOfRangeException;
import com.flagship.medici_ledger.ledger.exception.UnbalancedTransactionException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The ledger: owns the chart of accounts and the log of posted transactions.
 *
 * This class enforces the core invariants:
 * 1. Debits must equal credits (balanced transactions), checked before any balance moves
 * 2. Posted transactions are never edited or removed
 * 3. Sum of debit-normalized balances over all accounts stays zero
 *
 * Every balance change goes through {@link #postTransaction(Transaction)}.
 * Not thread-safe: one writer at a time.
 */
@Slf4j
public class Ledger {

    @Getter
    private final String name;
    private final Map<String, Account> accounts = new LinkedHashMap<>();
    private final List<Transaction> transactions = new ArrayList<>();

    public Ledger(String name) {
        this.name = name;
    }

    /**
     * Adds a new account to the chart of accounts.
     *
     * @throws IllegalArgumentException if the name is blank or already used
     */
    public Account createAccount(String accountName, AccountType type) {
        if (accountName == null || accountName.isBlank()) {
            throw new IllegalArgumentException("Account name is required");
        }
        if (type == null) {
            throw new IllegalArgumentException("Account type is required for " + accountName);
        }
        if (accounts.containsKey(accountName)) {
            throw new IllegalArgumentException("Account already exists: " + accountName);
        }
        Account account = new Account(accountName, type);
        accounts.put(accountName, account);
        log.debug("Created account: name={}, type={}", accountName, type);
        return account;
    }

    /**
     * Returns the account with this exact name, creating it with {@code type} if absent.
     * An existing account keeps its original type.
     */
    public Account getOrCreateAccount(String accountName, AccountType type) {
        Account existing = accounts.get(accountName);
        if (existing == null) {
            return createAccount(accountName, type);
        }
        if (existing.getType() != type) {
            log.warn("Account {} already exists as {}, ignoring requested type {}",
                accountName, existing.getType(), type);
        }
        return existing;
    }

    public Optional<Account> findAccount(String accountName) {
        return Optional.ofNullable(accounts.get(accountName));
    }

    public Account getAccount(String accountName) {
        return findAccount(accountName)
            .orElseThrow(() -> new IllegalArgumentException("Account not found: " + accountName));
    }

    public List<Account> getAccounts() {
        return List.copyOf(accounts.values());
    }

    public List<Transaction> getTransactions() {
        return Collections.unmodifiableList(transactions);
    }

    /**
     * Records a transaction from signed postings.
     *
     * For ASSET and EXPENSE accounts a non-negative amount is a debit and a negative amount
     * a credit of its absolute value; LIABILITY, EQUITY and REVENUE accounts are the other
     * way round.
     *
     * @return the posted transaction
     * @throws UnbalancedTransactionException if debits and credits differ; no balance is touched
     */
    public Transaction recordTransaction(LocalDate date, String description, Posting... postings) {
        Transaction transaction = new Transaction(date, description);
        for (Posting posting : postings) {
            if (posting.isDebit()) {
                transaction.addDebit(posting.toEntry());
            } else {
                transaction.addCredit(posting.toEntry());
            }
        }
        return postTransaction(transaction);
    }

    /**
     * Validates, posts and appends a fully built transaction.
     *
     * @throws IllegalArgumentException if an entry references an account of another ledger
     * @throws UnbalancedTransactionException if the transaction is not balanced
     * @throws AmountOutOfRangeException if a total or resulting balance overflows; nothing is posted
     */
    public Transaction postTransaction(Transaction transaction) {
        validateAccountsBelong(transaction);
        transaction.validate();

        transaction.post();
        transactions.add(transaction);

        log.debug("Posted to {}:{}{}", name, System.lineSeparator(), transaction);
        return transaction;
    }

    /**
     * Sum of every account's balance in the debit-positive convention.
     * Zero whenever the books are consistent.
     */
    public Money debitNormalizedTotal() {
        // partial sums may leave the long range even though the total is zero
        BigDecimal total = accounts.values().stream()
            .map(account -> account.getDebitNormalizedBalance().toBigDecimal())
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        return Money.of(total);
    }

    private void validateAccountsBelong(Transaction transaction) {
        List<TransactionEntry> all = new ArrayList<>(transaction.getDebits());
        all.addAll(transaction.getCredits());

        for (TransactionEntry entry : all) {
            Account account = entry.getAccount();
            if (accounts.get(account.getName()) != account) {
                throw new IllegalArgumentException("Account not found: " + account.getName());
            }
        }
    }
}
