package com.flagship.medici_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for ledger operations.
 *
 * Metrics exposed:
 * - ledger.transactions.recorded: transactions recorded through the programmatic API
 * - ledger.transactions.rejected: record calls rejected as unbalanced or out of range
 * - ledger.import.records: imported records, tagged by format and outcome (posted/skipped)
 * - ledger.import.duration: time taken by a whole import batch, tagged by format
 * - ledger.export.transactions: transactions written, tagged by format
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    private final Counter transactionsRecorded;
    private final Counter transactionsRejected;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.transactionsRecorded = Counter.builder("ledger.transactions.recorded")
                .description("Number of transactions recorded")
                .register(registry);

        this.transactionsRejected = Counter.builder("ledger.transactions.rejected")
                .description("Number of transactions rejected before posting")
                .register(registry);
    }

    public void incrementTransactionsRecorded() {
        transactionsRecorded.increment();
    }

    public void incrementTransactionsRejected() {
        transactionsRejected.increment();
    }

    public void recordImport(String format, int posted, int skipped, long durationMs) {
        registry.counter("ledger.import.records", "format", format, "outcome", "posted").increment(posted);
        registry.counter("ledger.import.records", "format", format, "outcome", "skipped").increment(skipped);
        registry.timer("ledger.import.duration", "format", format).record(Duration.ofMillis(durationMs));
    }

    public void recordImportFailure(String format) {
        registry.counter("ledger.import.failures", "format", format).increment();
    }

    public void recordExport(String format, int count) {
        registry.counter("ledger.export.transactions", "format", format).increment(count);
    }
}
