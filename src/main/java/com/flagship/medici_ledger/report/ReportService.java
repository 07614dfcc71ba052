package com.flagship.medici_ledger.report;

import com.flagship.medici_ledger.ledger.Account;
import com.flagship.medici_ledger.ledger.AccountType;
import com.flagship.medici_ledger.ledger.Ledger;
import com.flagship.medici_ledger.ledger.Money;
import com.flagship.medici_ledger.ledger.Transaction;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Read-side projections of a ledger. Nothing here mutates the ledger.
 */
@Service
public class ReportService {

    /**
     * A positive balance goes to the account type's natural column; a negative balance
     * (a contra account, for example) goes to the other column as its absolute value.
     * Zero balances are left out.
     */
    public TrialBalance trialBalance(Ledger ledger) {
        List<TrialBalance.Row> rows = new ArrayList<>();
        Money totalDebits = Money.ZERO;
        Money totalCredits = Money.ZERO;

        for (Account account : ledger.getAccounts()) {
            Money balance = account.getBalance();
            if (balance.isZero()) {
                continue;
            }
            boolean debitColumn = account.getType().isDebitNormal() != balance.isNegative();
            Money amount = balance.abs();
            if (debitColumn) {
                rows.add(new TrialBalance.Row(account.getName(), amount, Money.ZERO));
                totalDebits = totalDebits.plus(amount);
            } else {
                rows.add(new TrialBalance.Row(account.getName(), Money.ZERO, amount));
                totalCredits = totalCredits.plus(amount);
            }
        }

        return new TrialBalance(List.copyOf(rows), totalDebits, totalCredits);
    }

    public BalanceSheet balanceSheet(Ledger ledger) {
        List<ReportLine> assets = linesOf(ledger, AccountType.ASSET);
        List<ReportLine> liabilities = linesOf(ledger, AccountType.LIABILITY);
        List<ReportLine> equity = linesOf(ledger, AccountType.EQUITY);

        return new BalanceSheet(assets, liabilities, equity,
            sum(assets), sum(liabilities), sum(equity));
    }

    public IncomeStatement incomeStatement(Ledger ledger) {
        List<ReportLine> revenue = linesOf(ledger, AccountType.REVENUE);
        List<ReportLine> expenses = linesOf(ledger, AccountType.EXPENSE);

        return new IncomeStatement(revenue, expenses, sum(revenue), sum(expenses));
    }

    public LedgerSummary summary(Ledger ledger) {
        Money totalDebits = Money.ZERO;
        Money totalCredits = Money.ZERO;
        for (Transaction transaction : ledger.getTransactions()) {
            totalDebits = totalDebits.plus(transaction.getDebitTotal());
            totalCredits = totalCredits.plus(transaction.getCreditTotal());
        }

        return new LedgerSummary(ledger.getName(), ledger.getAccounts().size(),
            ledger.getTransactions().size(), totalDebits, totalCredits);
    }

    private static List<ReportLine> linesOf(Ledger ledger, AccountType type) {
        return ledger.getAccounts().stream()
            .filter(account -> account.getType() == type)
            .filter(account -> !account.getBalance().isZero())
            .map(account -> new ReportLine(account.getName(), type, account.getBalance()))
            .toList();
    }

    private static Money sum(List<ReportLine> lines) {
        return lines.stream()
            .map(ReportLine::getAmount)
            .reduce(Money.ZERO, Money::plus);
    }
}
