package com.flagship.medici_ledger.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.medici_ledger.ledger.Account;
import com.flagship.medici_ledger.ledger.AccountType;
import com.flagship.medici_ledger.ledger.Ledger;
import com.flagship.medici_ledger.ledger.Money;
import com.flagship.medici_ledger.ledger.Transaction;
import com.flagship.medici_ledger.ledger.TransactionEntry;
import com.flagship.medici_ledger.ledger.exception.LedgerException;
import com.flagship.medici_ledger.ledger.exception.MalformedDocumentException;
import com.flagship.medici_ledger.ledger.exception.MalformedRecordException;
import com.flagship.medici_ledger.ledger.exception.UnknownAccountTypeException;
import lombok.RequiredArgsConstructor;
import lombok.Value;
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
import java.util.List;
import java.util.Locale;

/**
 * Reads and writes transactions as a JSON array with every entry spelled out.
 *
 * Account types travel with each entry, so import never guesses a type from a name.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TransactionJsonCodec {

    public static final String FORMAT = "json";

    private final ObjectMapper objectMapper;

    /**
     * @return number of transactions written
     */
    public int exportToJson(Ledger ledger, Path path) throws IOException {
        List<JsonTransactionRecord> records = new ArrayList<>();
        int sequence = 0;
        for (Transaction transaction : ledger.getTransactions()) {
            sequence++;
            records.add(toRecord(String.valueOf(sequence), transaction));
        }

        try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(writer, records);
        }

        log.info("Exported {} transactions to JSON: path={}", records.size(), path);
        return records.size();
    }

    /**
     * Imports every record it can; records that fail to parse or balance are skipped.
     *
     * @param verbose log each skipped record at WARN instead of DEBUG
     * @throws IOException if the file is missing or is not valid JSON
     * @throws MalformedDocumentException if the document is not a JSON array
     */
    public ImportResult importFromJson(Ledger ledger, Path path, boolean verbose) throws IOException {
        JsonNode root;
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            root = objectMapper.readTree(reader);
        }
        if (root == null || !root.isArray()) {
            throw new MalformedDocumentException(
                "Expected a JSON array of transactions in " + path);
        }

        int posted = 0;
        int skipped = 0;
        int index = 0;
        for (JsonNode node : root) {
            index++;
            try {
                JsonTransactionRecord record = bind(node, index);
                ledger.postTransaction(toTransaction(ledger, record, index));
                posted++;
            } catch (LedgerException | IllegalArgumentException e) {
                skipped++;
                if (verbose) {
                    log.warn("Skipping JSON record {}: {}", index, e.getMessage());
                } else {
                    log.debug("Skipping JSON record {}: {}", index, e.getMessage());
                }
            }
        }

        return new ImportResult(FORMAT, posted, skipped);
    }

    private JsonTransactionRecord bind(JsonNode node, int index) {
        if (!node.isObject()) {
            String id = "#" + index;
            throw new MalformedRecordException(id,
                String.format("Record %s: expected an object but found %s", id, node.getNodeType()));
        }
        try {
            return objectMapper.treeToValue(node, JsonTransactionRecord.class);
        } catch (JsonProcessingException e) {
            String id = "#" + index;
            throw new MalformedRecordException(id,
                String.format("Record %s: not a transaction object (%s)", id, e.getOriginalMessage()), e);
        }
    }

    private Transaction toTransaction(Ledger ledger, JsonTransactionRecord record, int index) {
        String id = RecordFields.isBlank(record.getId()) ? "#" + index : record.getId().trim();

        LocalDate date = RecordFields.date(id, record.getDate());
        List<ParsedEntry> debits = parseEntries(id, "debits", record.getDebits());
        List<ParsedEntry> credits = parseEntries(id, "credits", record.getCredits());

        Transaction transaction = new Transaction(date,
            record.getDescription() == null ? "" : record.getDescription());
        for (ParsedEntry entry : debits) {
            transaction.addDebit(entry.toEntry(ledger));
        }
        for (ParsedEntry entry : credits) {
            transaction.addCredit(entry.toEntry(ledger));
        }
        return transaction;
    }

    private static List<ParsedEntry> parseEntries(String id, String side, List<JsonEntryRecord> entries) {
        List<ParsedEntry> parsed = new ArrayList<>();
        if (entries == null) {
            return parsed;
        }
        for (JsonEntryRecord entry : entries) {
            if (entry == null) {
                throw new MalformedRecordException(id,
                    String.format("Record %s: null entry in %s", id, side));
            }
            String account = RecordFields.required(id, side + ".account", entry.getAccount());
            AccountType type = parseAccountType(id, entry.getAccountType());
            Money amount = RecordFields.amount(id, side + ".amount", entry.getAmount());
            parsed.add(new ParsedEntry(account, type, amount));
        }
        return parsed;
    }

    static AccountType parseAccountType(String id, String value) {
        String text = RecordFields.required(id, "account_type", value);
        try {
            return AccountType.valueOf(text.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new UnknownAccountTypeException(text);
        }
    }

    private static JsonTransactionRecord toRecord(String id, Transaction transaction) {
        return JsonTransactionRecord.builder()
            .id(id)
            .date(transaction.getDate().toString())
            .description(transaction.getDescription())
            .debits(toEntryRecords(transaction.getDebits()))
            .credits(toEntryRecords(transaction.getCredits()))
            .build();
    }

    private static List<JsonEntryRecord> toEntryRecords(List<TransactionEntry> entries) {
        return entries.stream()
            .map(entry -> JsonEntryRecord.builder()
                .account(entry.getAccount().getName())
                .accountType(entry.getAccount().getType().name())
                .amount(entry.getAmount().toPlainString())
                .build())
            .toList();
    }

    @Value
    private static class ParsedEntry {
        String account;
        AccountType type;
        Money amount;

        TransactionEntry toEntry(Ledger ledger) {
            Account resolved = ledger.getOrCreateAccount(account, type);
            return TransactionEntry.of(resolved, amount);
        }
    }
}
