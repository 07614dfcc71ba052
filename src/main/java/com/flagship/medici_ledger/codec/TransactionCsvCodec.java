package com.flagship.medici_ledger.codec;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.flagship.medici_ledger.ledger.Account;
import com.flagship.medici_ledger.ledger.AccountResolver;
import com.flagship.medici_ledger.ledger.Ledger;
import com.flagship.medici_ledger.ledger.Money;
import com.flagship.medici_ledger.ledger.Transaction;
import com.flagship.medici_ledger.ledger.TransactionEntry;
import com.flagship.medici_ledger.ledger.exception.LedgerException;
import com.flagship.medici_ledger.ledger.exception.MalformedRecordException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Reads and writes transactions in the flat CSV format.
 *
 * The format is lossy in two documented ways:
 * - several debit accounts share one debit_amount, which import splits equally
 *   between them (export writes the sum, so uneven debits come back even)
 * - only two credit legs fit in a row; export drops any further legs
 * Use the JSON format when exact per-entry amounts matter.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TransactionCsvCodec {

    public static final String FORMAT = "csv";

    private static final String NAME_SEPARATOR = ",";

    private final CsvMapper csvMapper;
    private final AccountResolver accountResolver;

    /**
     * Writes one row per transaction of the ledger.
     *
     * @return number of rows written
     */
    public int exportToCsv(Ledger ledger, Path path) throws IOException {
        CsvSchema schema = csvMapper.schemaFor(CsvTransactionRecord.class).withHeader();
        int sequence = 0;

        try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
             SequenceWriter rows = csvMapper.writer(schema).writeValues(writer)) {
            for (Transaction transaction : ledger.getTransactions()) {
                sequence++;
                rows.write(toRecord(String.valueOf(sequence), transaction));
            }
        }

        log.info("Exported {} transactions to CSV: path={}", sequence, path);
        return sequence;
    }

    /**
     * Imports every row it can; rows that fail to parse or balance are skipped.
     *
     * @param verbose log each skipped row at WARN instead of DEBUG
     * @throws IOException if the file is missing or is not readable CSV
     */
    public ImportResult importFromCsv(Ledger ledger, Path path, boolean verbose) throws IOException {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        int posted = 0;
        int skipped = 0;
        int rowNumber = 0;

        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             MappingIterator<CsvTransactionRecord> rows = csvMapper
                 .readerFor(CsvTransactionRecord.class)
                 .with(schema)
                 .readValues(reader)) {
            while (rows.hasNextValue()) {
                CsvTransactionRecord record = rows.nextValue();
                rowNumber++;
                try {
                    ledger.postTransaction(toTransaction(ledger, record, rowNumber));
                    posted++;
                } catch (LedgerException | IllegalArgumentException e) {
                    skipped++;
                    logSkipped(verbose, rowNumber, e);
                }
            }
        }

        return new ImportResult(FORMAT, posted, skipped);
    }

    private Transaction toTransaction(Ledger ledger, CsvTransactionRecord record, int rowNumber) {
        String id = RecordFields.isBlank(record.getId()) ? "row " + rowNumber : record.getId().trim();

        // parse everything before resolving names so a bad row creates no accounts
        LocalDate date = RecordFields.date(id, record.getDate());
        List<String> debitNames = splitNames(record.getDebitAccount());
        if (debitNames.isEmpty()) {
            throw new MalformedRecordException(id,
                String.format("Record %s: missing required field 'debit_account'", id));
        }
        Money debitAmount = RecordFields.amount(id, "debit_amount", record.getDebitAmount());
        String creditName = RecordFields.required(id, "credit_account", record.getCreditAccount());
        Money creditAmount = RecordFields.amount(id, "credit_amount", record.getCreditAmount());

        String secondCreditName = null;
        Money secondCreditAmount = null;
        if (!RecordFields.isBlank(record.getCreditAmount2())) {
            Money amount = RecordFields.signedAmount(id, "credit_amount_2", record.getCreditAmount2());
            if (amount.isPositive()) {
                secondCreditName = RecordFields.required(id, "credit_account_2", record.getCreditAccount2());
                secondCreditAmount = amount;
            }
        }

        Transaction transaction = new Transaction(date,
            record.getDescription() == null ? "" : record.getDescription());

        Money share = debitAmount.divideEvenly(debitNames.size());
        for (String name : debitNames) {
            transaction.addDebit(TransactionEntry.of(accountResolver.resolve(ledger, name), share));
        }
        transaction.addCredit(TransactionEntry.of(accountResolver.resolve(ledger, creditName), creditAmount));
        if (secondCreditName != null) {
            Account second = accountResolver.resolve(ledger, secondCreditName);
            transaction.addCredit(TransactionEntry.of(second, secondCreditAmount));
        }
        return transaction;
    }

    private CsvTransactionRecord toRecord(String id, Transaction transaction) {
        List<TransactionEntry> credits = transaction.getCredits();
        if (credits.size() > 2) {
            log.warn("Transaction {} ({}) has {} credit legs, CSV keeps only the first two",
                id, transaction.getDescription(), credits.size());
        }

        CsvTransactionRecord.CsvTransactionRecordBuilder record = CsvTransactionRecord.builder()
            .id(id)
            .date(transaction.getDate().toString())
            .description(transaction.getDescription())
            .debitAccount(transaction.getDebits().stream()
                .map(entry -> entry.getAccount().getName())
                .collect(Collectors.joining(NAME_SEPARATOR)))
            .debitAmount(transaction.getDebitTotal().toPlainString());

        if (!credits.isEmpty()) {
            record.creditAccount(credits.get(0).getAccount().getName())
                .creditAmount(credits.get(0).getAmount().toPlainString());
        }
        if (credits.size() > 1) {
            record.creditAccount2(credits.get(1).getAccount().getName())
                .creditAmount2(credits.get(1).getAmount().toPlainString());
        }
        return record.build();
    }

    private static List<String> splitNames(String joined) {
        if (RecordFields.isBlank(joined)) {
            return new ArrayList<>();
        }
        return Arrays.stream(joined.split(NAME_SEPARATOR))
            .map(String::trim)
            .filter(name -> !name.isEmpty())
            .collect(Collectors.toList());
    }

    private static void logSkipped(boolean verbose, int rowNumber, Exception e) {
        if (verbose) {
            log.warn("Skipping CSV row {}: {}", rowNumber, e.getMessage());
        } else {
            log.debug("Skipping CSV row {}: {}", rowNumber, e.getMessage());
        }
    }
}
