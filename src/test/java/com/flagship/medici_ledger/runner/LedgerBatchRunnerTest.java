package com.flagship.medici_ledger.runner;

import com.flagship.medici_ledger.codec.TransactionCsvCodec;
import com.flagship.medici_ledger.codec.TransactionJsonCodec;
import com.flagship.medici_ledger.config.JacksonConfig;
import com.flagship.medici_ledger.config.LedgerProperties;
import com.flagship.medici_ledger.ledger.AccountResolver;
import com.flagship.medici_ledger.ledger.Ledger;
import com.flagship.medici_ledger.ledger.LedgerService;
import com.flagship.medici_ledger.ledger.MediciBankFixture;
import com.flagship.medici_ledger.ledger.Money;
import com.flagship.medici_ledger.observability.LedgerMetrics;
import com.flagship.medici_ledger.report.ReportPrinter;
import com.flagship.medici_ledger.report.ReportService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class LedgerBatchRunnerTest {

    @TempDir
    Path tempDir;

    private LedgerService ledgerService;
    private LedgerProperties properties;

    @BeforeEach
    void setUp() {
        JacksonConfig jacksonConfig = new JacksonConfig();
        ledgerService = new LedgerService(
            new TransactionCsvCodec(jacksonConfig.csvMapper(), new AccountResolver()),
            new TransactionJsonCodec(jacksonConfig.objectMapper()),
            new ReportService(),
            new ReportPrinter(),
            new LedgerMetrics(new SimpleMeterRegistry()));
        properties = new LedgerProperties();
    }

    @Test
    @DisplayName("Batch imports, prints reports and exports")
    void testFullRun() throws IOException {
        // Given: the Medici year exported as JSON
        Path input = tempDir.resolve("input.json");
        ledgerService.exportTransactionsToJson(MediciBankFixture.year1397(), input);
        Path csvOut = tempDir.resolve("out.csv");
        Path jsonOut = tempDir.resolve("out.json");
        properties.getImport().setJson(input);
        properties.getExport().setCsv(csvOut);
        properties.getExport().setJson(jsonOut);

        Ledger ledger = new Ledger("Medici Family Bank");
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();

        // When
        new LedgerBatchRunner(ledger, ledgerService, properties)
            .run(new PrintStream(buffer, true, StandardCharsets.UTF_8));

        // Then
        assertEquals(5, ledger.getTransactions().size());
        assertEquals(Money.of("5400.00"), ledger.getAccount("Cash").getBalance());
        String text = buffer.toString(StandardCharsets.UTF_8);
        assertTrue(text.contains("=== MEDICI FAMILY BANK TRIAL BALANCE ==="));
        assertTrue(text.contains("=== MEDICI FAMILY BANK BALANCE SHEET ==="));
        assertTrue(text.contains("=== MEDICI FAMILY BANK INCOME STATEMENT ==="));
        assertTrue(text.contains("=== MEDICI FAMILY BANK SUMMARY ==="));
        assertTrue(Files.exists(csvOut));
        assertTrue(Files.exists(jsonOut));
        assertEquals(6, Files.readAllLines(csvOut).size());
    }

    @Test
    @DisplayName("Run with nothing configured touches nothing")
    void testNothingConfigured() throws IOException {
        properties.getReports().setPrint(false);
        Ledger ledger = new Ledger("Empty");
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();

        new LedgerBatchRunner(ledger, ledgerService, properties)
            .run(new PrintStream(buffer, true, StandardCharsets.UTF_8));

        assertEquals(0, buffer.size());
        assertTrue(ledger.getTransactions().isEmpty());
        try (var files = Files.list(tempDir)) {
            assertEquals(0, files.count());
        }
    }
}
