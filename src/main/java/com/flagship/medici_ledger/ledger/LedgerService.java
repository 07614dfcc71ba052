package com.flagship.medici_ledger.ledger;

import com.flagship.medici_ledger.codec.ImportResult;
import com.flagship.medici_ledger.codec.TransactionCsvCodec;
import com.flagship.medici_ledger.codec.TransactionJsonCodec;
import com.flagship.medici_ledger.ledger.exception.AmountOutOfRangeException;
import com.flagship.medici_ledger.ledger.exception.UnbalancedTransactionException;
import com.flagship.medici_ledger.observability.LedgerMetrics;
import com.flagship.medici_ledger.report.ReportPrinter;
import com.flagship.medici_ledger.report.ReportService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Entry point for working with a ledger from application code.
 *
 * Wraps the ledger's own recording rules with logging and metrics, and wires
 * the CSV/JSON codecs and the report printer to it.
 *
 * Key principles:
 * - Programmatic recording never drops a transaction silently: errors propagate
 * - Imports are best-effort: bad records are skipped, the count of posted ones is returned
 * - Missing or malformed files abort the import and propagate to the caller
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {

    static final String LEDGER_MDC_KEY = "ledger";
    static final String IMPORT_ID_MDC_KEY = "importId";

    private final TransactionCsvCodec csvCodec;
    private final TransactionJsonCodec jsonCodec;
    private final ReportService reportService;
    private final ReportPrinter reportPrinter;
    private final LedgerMetrics ledgerMetrics;

    /**
     * Records a transaction on the ledger.
     *
     * @throws UnbalancedTransactionException if debits and credits differ
     * @throws AmountOutOfRangeException if a resulting balance would overflow
     */
    public Transaction recordTransaction(Ledger ledger, LocalDate date, String description,
                                         Posting... postings) {
        try {
            Transaction transaction = ledger.recordTransaction(date, description, postings);
            ledgerMetrics.incrementTransactionsRecorded();
            return transaction;
        } catch (UnbalancedTransactionException | AmountOutOfRangeException e) {
            ledgerMetrics.incrementTransactionsRejected();
            log.warn("Rejected transaction '{}' on {}: {}", description, ledger.getName(), e.getMessage());
            throw e;
        }
    }

    public int exportTransactionsToCsv(Ledger ledger, Path path) throws IOException {
        MDC.put(LEDGER_MDC_KEY, ledger.getName());
        try {
            int count = csvCodec.exportToCsv(ledger, path);
            ledgerMetrics.recordExport(TransactionCsvCodec.FORMAT, count);
            return count;
        } finally {
            MDC.remove(LEDGER_MDC_KEY);
        }
    }

    public int exportTransactionsToJson(Ledger ledger, Path path) throws IOException {
        MDC.put(LEDGER_MDC_KEY, ledger.getName());
        try {
            int count = jsonCodec.exportToJson(ledger, path);
            ledgerMetrics.recordExport(TransactionJsonCodec.FORMAT, count);
            return count;
        } finally {
            MDC.remove(LEDGER_MDC_KEY);
        }
    }

    /**
     * @return number of rows successfully posted
     */
    public int importTransactionsFromCsv(Ledger ledger, Path path, boolean verbose) throws IOException {
        return runImport(TransactionCsvCodec.FORMAT, ledger, path,
            () -> csvCodec.importFromCsv(ledger, path, verbose));
    }

    /**
     * @return number of records successfully posted
     */
    public int importTransactionsFromJson(Ledger ledger, Path path, boolean verbose) throws IOException {
        return runImport(TransactionJsonCodec.FORMAT, ledger, path,
            () -> jsonCodec.importFromJson(ledger, path, verbose));
    }

    public void printTrialBalance(Ledger ledger) {
        printTrialBalance(ledger, System.out);
    }

    public void printTrialBalance(Ledger ledger, PrintStream out) {
        reportPrinter.print(reportService.trialBalance(ledger), out);
    }

    public void printBalanceSheet(Ledger ledger) {
        printBalanceSheet(ledger, System.out);
    }

    public void printBalanceSheet(Ledger ledger, PrintStream out) {
        reportPrinter.print(reportService.balanceSheet(ledger), out);
    }

    public void printIncomeStatement(Ledger ledger) {
        printIncomeStatement(ledger, System.out);
    }

    public void printIncomeStatement(Ledger ledger, PrintStream out) {
        reportPrinter.print(reportService.incomeStatement(ledger), out);
    }

    public void printSummary(Ledger ledger, PrintStream out) {
        reportPrinter.print(reportService.summary(ledger), out);
    }

    private int runImport(String format, Ledger ledger, Path path, ImportCall call) throws IOException {
        long startTime = System.currentTimeMillis();
        MDC.put(LEDGER_MDC_KEY, ledger.getName());
        MDC.put(IMPORT_ID_MDC_KEY, UUID.randomUUID().toString().substring(0, 8));

        log.info("Importing transactions: format={}, path={}", format, path);

        try {
            ImportResult result = call.run();
            long duration = System.currentTimeMillis() - startTime;
            ledgerMetrics.recordImport(format, result.getPosted(), result.getSkipped(), duration);

            log.info("Import finished: format={}, posted={}, skipped={}, duration={}ms",
                format, result.getPosted(), result.getSkipped(), duration);
            return result.getPosted();

        } catch (IOException | RuntimeException e) {
            ledgerMetrics.recordImportFailure(format);
            log.error("Import failed: format={}, path={}, error={}", format, path, e.getMessage());
            throw e;
        } finally {
            MDC.remove(IMPORT_ID_MDC_KEY);
            MDC.remove(LEDGER_MDC_KEY);
        }
    }

    @FunctionalInterface
    private interface ImportCall {
        ImportResult run() throws IOException;
    }
}
