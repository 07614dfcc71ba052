package com.flagship.medici_ledger.report;

import com.flagship.medici_ledger.ledger.Money;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;

/**
 * Renders reports as fixed-width text.
 */
@Component
public class ReportPrinter {

    private static final String TRIAL_ROW = "%-30s %-15s %-15s%n";
    private static final String AMOUNT_ROW = "%-30s %10s%n";
    private static final String TRIAL_RULE = "-".repeat(60);
    private static final String RULE = "-".repeat(40);

    public void print(TrialBalance trialBalance, PrintStream out) {
        out.printf(TRIAL_ROW, "Account", "Debit", "Credit");
        out.println(TRIAL_RULE);
        for (TrialBalance.Row row : trialBalance.getRows()) {
            if (row.isDebit()) {
                out.printf(TRIAL_ROW, row.getAccountName(), row.getDebit(), "");
            } else {
                out.printf(TRIAL_ROW, row.getAccountName(), "", row.getCredit());
            }
        }
        out.println(TRIAL_RULE);
        out.printf(TRIAL_ROW, "TOTAL", trialBalance.getTotalDebits(), trialBalance.getTotalCredits());
        out.println();
        out.println(trialBalance.isBalanced()
            ? "The books are balanced."
            : "WARNING: The books are NOT balanced!");
    }

    public void print(BalanceSheet sheet, PrintStream out) {
        section(out, "ASSETS", sheet.getAssets(), "TOTAL ASSETS", sheet.getTotalAssets());
        section(out, "LIABILITIES", sheet.getLiabilities(), "TOTAL LIABILITIES", sheet.getTotalLiabilities());
        section(out, "EQUITY", sheet.getEquity(), "TOTAL EQUITY", sheet.getTotalEquity());

        out.println("ACCOUNTING EQUATION");
        out.println(RULE);
        out.printf(AMOUNT_ROW, "Total Assets", sheet.getTotalAssets());
        out.printf(AMOUNT_ROW, "Total Liabilities + Equity", sheet.getTotalLiabilitiesAndEquity());
        out.println();
        out.println(sheet.isBalanced()
            ? "The accounting equation is balanced."
            : "WARNING: The accounting equation is NOT balanced!");
    }

    public void print(IncomeStatement statement, PrintStream out) {
        section(out, "REVENUE", statement.getRevenue(), "TOTAL REVENUE", statement.getTotalRevenue());
        section(out, "EXPENSES", statement.getExpenses(), "TOTAL EXPENSES", statement.getTotalExpenses());

        out.println("SUMMARY");
        out.println(RULE);
        out.printf(AMOUNT_ROW, "Total Revenue", statement.getTotalRevenue());
        out.printf(AMOUNT_ROW, "Total Expenses", statement.getTotalExpenses());
        out.println(RULE);
        out.printf(AMOUNT_ROW, "NET INCOME", statement.getNetIncome());
    }

    public void print(LedgerSummary summary, PrintStream out) {
        out.printf("%-30s %s%n", "Ledger", summary.getLedgerName());
        out.printf("%-30s %d%n", "Accounts", summary.getAccountCount());
        out.printf("%-30s %d%n", "Transactions", summary.getTransactionCount());
        out.printf(AMOUNT_ROW, "Total debits", summary.getTotalDebits());
        out.printf(AMOUNT_ROW, "Total credits", summary.getTotalCredits());
        out.printf(AMOUNT_ROW, "Difference", summary.getDifference());
    }

    private static void section(PrintStream out, String title, List<ReportLine> lines,
                                String totalLabel, Money total) {
        out.println(title);
        out.println(RULE);
        for (ReportLine line : lines) {
            out.printf(AMOUNT_ROW, line.getAccountName(), line.getAmount());
        }
        out.println(RULE);
        out.printf(AMOUNT_ROW, totalLabel, total);
        out.println();
    }
}
