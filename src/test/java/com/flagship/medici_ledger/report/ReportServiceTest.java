package com.flagship.medici_ledger.report;

import com.flagship.medici_ledger.ledger.AccountType;
import com.flagship.medici_ledger.ledger.Ledger;
import com.flagship.medici_ledger.ledger.MediciBankFixture;
import com.flagship.medici_ledger.ledger.Money;
import com.flagship.medici_ledger.ledger.Posting;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReportServiceTest {

    private final ReportService reportService = new ReportService();

    // ========================================================================
    // TRIAL BALANCE
    // ========================================================================

    @Nested
    @DisplayName("1. Trial Balance")
    class TrialBalanceTests {

        @Test
        @DisplayName("Trial balance of the Medici year")
        void testTrialBalance() {
            TrialBalance trialBalance = reportService.trialBalance(MediciBankFixture.year1397());

            assertEquals(Money.of("10200.00"), trialBalance.getTotalDebits());
            assertEquals(Money.of("10200.00"), trialBalance.getTotalCredits());
            assertTrue(trialBalance.isBalanced());
            assertEquals(List.of("Cash", "Accounts Receivable", "Land", "Owner's Capital", "Interest Income", "Wages"),
                trialBalance.getRows().stream().map(TrialBalance.Row::getAccountName).toList());

            TrialBalance.Row capital = trialBalance.getRows().get(3);
            assertFalse(capital.isDebit());
            assertEquals(Money.of("10000.00"), capital.getCredit());
            assertEquals(Money.ZERO, capital.getDebit());
        }

        @Test
        @DisplayName("Negative balance goes to the opposite column")
        void testContraAccount() {
            Ledger ledger = new Ledger("Contra");
            ledger.createAccount("Depreciation", AccountType.EXPENSE);
            ledger.createAccount("Accumulated Depreciation", AccountType.ASSET);
            ledger.recordTransaction(LocalDate.of(2024, 12, 31), "Depreciation",
                Posting.of(ledger.getAccount("Depreciation"), "250.00"),
                Posting.of(ledger.getAccount("Accumulated Depreciation"), "-250.00"));

            TrialBalance trialBalance = reportService.trialBalance(ledger);

            TrialBalance.Row contra = trialBalance.getRows().get(1);
            assertEquals("Accumulated Depreciation", contra.getAccountName());
            assertFalse(contra.isDebit());
            assertEquals(Money.of("250.00"), contra.getCredit());
            assertTrue(trialBalance.isBalanced());
        }
    }

    // ========================================================================
    // BALANCE SHEET
    // ========================================================================

    @Nested
    @DisplayName("2. Balance Sheet")
    class BalanceSheetTests {

        @Test
        @DisplayName("Balance sheet without closing entries")
        void testBalanceSheet() {
            BalanceSheet sheet = reportService.balanceSheet(MediciBankFixture.year1397());

            assertEquals(3, sheet.getAssets().size());
            assertTrue(sheet.getLiabilities().isEmpty());
            assertEquals(Money.of("9400.00"), sheet.getTotalAssets());
            assertEquals(Money.ZERO, sheet.getTotalLiabilities());
            assertEquals(Money.of("10000.00"), sheet.getTotalEquity());
            assertEquals(Money.of("10000.00"), sheet.getTotalLiabilitiesAndEquity());
            // the 600.00 loss is still in revenue and expense accounts
            assertFalse(sheet.isBalanced());
        }

        @Test
        @DisplayName("Balance sheet balances when only permanent accounts moved")
        void testBalanceSheetBalanced() {
            Ledger ledger = MediciBankFixture.chartOfAccounts();
            ledger.recordTransaction(LocalDate.of(1397, 1, 1), "Investment",
                Posting.of(ledger.getAccount("Cash"), "1000.00"),
                Posting.of(ledger.getAccount("Owner's Capital"), "1000.00"));
            ledger.recordTransaction(LocalDate.of(1397, 1, 2), "Borrowing",
                Posting.of(ledger.getAccount("Cash"), "500.00"),
                Posting.of(ledger.getAccount("Loans"), "500.00"));

            BalanceSheet sheet = reportService.balanceSheet(ledger);

            assertTrue(sheet.isBalanced());
            assertEquals(Money.of("1500.00"), sheet.getTotalAssets());
        }
    }

    // ========================================================================
    // INCOME STATEMENT AND SUMMARY
    // ========================================================================

    @Nested
    @DisplayName("3. Income Statement and Summary")
    class IncomeAndSummaryTests {

        @Test
        @DisplayName("Income statement of the Medici year shows a loss")
        void testIncomeStatement() {
            IncomeStatement statement = reportService.incomeStatement(MediciBankFixture.year1397());

            assertEquals(Money.of("200.00"), statement.getTotalRevenue());
            assertEquals(Money.of("800.00"), statement.getTotalExpenses());
            assertEquals(Money.of("-600.00"), statement.getNetIncome());
            assertEquals(AccountType.EXPENSE, statement.getExpenses().get(0).getAccountType());
        }

        @Test
        @DisplayName("Summary adds up the whole transaction log")
        void testSummary() {
            LedgerSummary summary = reportService.summary(MediciBankFixture.year1397());

            assertEquals("Medici Family Bank", summary.getLedgerName());
            assertEquals(12, summary.getAccountCount());
            assertEquals(5, summary.getTransactionCount());
            assertEquals(Money.of("17000.00"), summary.getTotalDebits());
            assertEquals(Money.ZERO, summary.getDifference());
            assertTrue(summary.isBalanced());
        }
    }

    @Test
    @DisplayName("Empty ledger produces empty, balanced reports")
    void testEmptyLedger() {
        Ledger ledger = MediciBankFixture.chartOfAccounts();

        assertTrue(reportService.trialBalance(ledger).getRows().isEmpty());
        assertTrue(reportService.trialBalance(ledger).isBalanced());
        assertTrue(reportService.balanceSheet(ledger).isBalanced());
        assertEquals(Money.ZERO, reportService.incomeStatement(ledger).getNetIncome());
    }
}
