package com.flagship.medici_ledger.runner;

import com.flagship.medici_ledger.config.LedgerProperties;
import com.flagship.medici_ledger.ledger.Ledger;
import com.flagship.medici_ledger.ledger.LedgerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;

/**
 * One batch pass over the application ledger: import the configured files,
 * print the reports, then export to the configured targets.
 *
 * Disabled with {@code ledger.runner.enabled=false}.
 */
@Component
@ConditionalOnProperty(name = "ledger.runner.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class LedgerBatchRunner implements ApplicationRunner {

    private final Ledger ledger;
    private final LedgerService ledgerService;
    private final LedgerProperties properties;

    @Override
    public void run(ApplicationArguments args) throws IOException {
        run(System.out);
    }

    void run(PrintStream out) throws IOException {
        LedgerProperties.Import imports = properties.getImport();
        if (imports.getCsv() != null) {
            ledgerService.importTransactionsFromCsv(ledger, imports.getCsv(), imports.isVerbose());
        }
        if (imports.getJson() != null) {
            ledgerService.importTransactionsFromJson(ledger, imports.getJson(), imports.isVerbose());
        }

        if (properties.getReports().isPrint()) {
            printReports(out);
        }

        LedgerProperties.Export export = properties.getExport();
        if (export.getCsv() != null) {
            ledgerService.exportTransactionsToCsv(ledger, export.getCsv());
        }
        if (export.getJson() != null) {
            ledgerService.exportTransactionsToJson(ledger, export.getJson());
        }

        log.info("Batch run complete: ledger={}, accounts={}, transactions={}",
            ledger.getName(), ledger.getAccounts().size(), ledger.getTransactions().size());
    }

    private void printReports(PrintStream out) {
        String name = ledger.getName().toUpperCase();

        out.println();
        out.println("=== " + name + " TRIAL BALANCE ===");
        ledgerService.printTrialBalance(ledger, out);

        out.println();
        out.println("=== " + name + " BALANCE SHEET ===");
        ledgerService.printBalanceSheet(ledger, out);

        out.println();
        out.println("=== " + name + " INCOME STATEMENT ===");
        ledgerService.printIncomeStatement(ledger, out);

        out.println();
        out.println("=== " + name + " SUMMARY ===");
        ledgerService.printSummary(ledger, out);
    }
}
