package com.flagship.accrual_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for ledger runs.
 *
 * Metrics exposed:
 * - ledger.rows.received: Counter of raw rows handed to the pipeline
 * - ledger.events.classified: Counter of classified events, tagged by type
 * - ledger.transactions.emitted: Counter of emitted transactions, tagged by type
 * - ledger.warnings: Counter of collected warnings, tagged by kind
 * - ledger.runs: Counter of finished runs, tagged by outcome
 * - ledger.run.duration: Timer for whole runs
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    private final Counter rowsReceived;
    private final Timer runTimer;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.rowsReceived = Counter.builder("ledger.rows.received")
                .description("Number of raw rows handed to the pipeline")
                .register(registry);

        this.runTimer = Timer.builder("ledger.run.duration")
                .description("Time taken to synthesize transactions for one run")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordRowsReceived(int count) {
        rowsReceived.increment(count);
    }

    public void recordEventClassified(String eventType) {
        registry.counter("ledger.events.classified", "type", sanitizeTag(eventType)).increment();
    }

    public void recordTransactionEmitted(String eventType) {
        registry.counter("ledger.transactions.emitted", "type", sanitizeTag(eventType)).increment();
    }

    public void recordWarning(String kind) {
        registry.counter("ledger.warnings", "kind", sanitizeTag(kind)).increment();
    }

    public void recordRun(String outcome, Duration duration) {
        registry.counter("ledger.runs", "outcome", sanitizeTag(outcome)).increment();
        runTimer.record(duration);
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
