package com.flagship.medici_ledger.report;

import com.flagship.medici_ledger.ledger.Ledger;
import com.flagship.medici_ledger.ledger.MediciBankFixture;
import com.flagship.medici_ledger.ledger.Money;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReportPrinterTest {

    private final ReportService reportService = new ReportService();
    private final ReportPrinter reportPrinter = new ReportPrinter();

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

    @Test
    @DisplayName("Trial balance puts each amount in its column")
    void testPrintTrialBalance() {
        reportPrinter.print(reportService.trialBalance(MediciBankFixture.year1397()), out);

        String text = output();
        assertTrue(text.contains(String.format("%-30s %-15s %-15s", "Cash", "5400.00", "")));
        assertTrue(text.contains(String.format("%-30s %-15s %-15s", "Owner's Capital", "", "10000.00")));
        assertTrue(text.contains(String.format("%-30s %-15s %-15s", "TOTAL", "10200.00", "10200.00")));
        assertTrue(text.contains("The books are balanced."));
        assertFalse(text.contains("Inventory"));
    }

    @Test
    @DisplayName("Unbalanced trial balance prints a warning")
    void testPrintUnbalancedWarning() {
        TrialBalance broken = new TrialBalance(
            List.of(new TrialBalance.Row("Cash", Money.of("1.00"), Money.ZERO)),
            Money.of("1.00"), Money.ZERO);

        reportPrinter.print(broken, out);

        assertTrue(output().contains("WARNING: The books are NOT balanced!"));
    }

    @Test
    @DisplayName("Balance sheet and income statement sections")
    void testPrintStatements() {
        Ledger ledger = MediciBankFixture.year1397();

        reportPrinter.print(reportService.balanceSheet(ledger), out);
        reportPrinter.print(reportService.incomeStatement(ledger), out);

        String text = output();
        assertTrue(text.contains("ASSETS"));
        assertTrue(text.contains(String.format("%-30s %10s", "TOTAL ASSETS", "9400.00")));
        assertTrue(text.contains(String.format("%-30s %10s", "Total Liabilities + Equity", "10000.00")));
        assertTrue(text.contains("WARNING: The accounting equation is NOT balanced!"));
        assertTrue(text.contains(String.format("%-30s %10s", "NET INCOME", "-600.00")));
    }

    @Test
    @DisplayName("Summary lists counts and totals")
    void testPrintSummary() {
        reportPrinter.print(reportService.summary(MediciBankFixture.year1397()), out);

        String text = output();
        assertTrue(text.contains(String.format("%-30s %d", "Transactions", 5)));
        assertTrue(text.contains(String.format("%-30s %10s", "Difference", "0.00")));
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }
}
