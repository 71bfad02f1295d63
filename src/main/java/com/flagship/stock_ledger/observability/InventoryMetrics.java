package com.flagship.stock_ledger.observability;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralized metrics for catalog and ledger operations.
 *
 * Metrics exposed:
 * - inventory.transactions.recorded: ledger writes, tagged by operation and movement type
 * - inventory.items.changed: catalog writes, tagged by operation
 * - inventory.cascade: rename/delete cascades, tagged by operation and outcome
 * - inventory.reconciliation.latency: duration of the full item listing
 * - inventory.transactions.orphaned: gauge of ledger rows naming no catalog item
 */
@Component
public class InventoryMetrics {

    private final MeterRegistry registry;

    public InventoryMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTransactionWritten(String operation, String movementType) {
        registry.counter("inventory.transactions.recorded",
                "operation", sanitizeTag(operation),
                "type", sanitizeTag(movementType)
        ).increment();
    }

    public void recordItemChanged(String operation) {
        registry.counter("inventory.items.changed",
                "operation", sanitizeTag(operation)
        ).increment();
    }

    /**
     * Records a cascade over the ledger with the number of rows it touched.
     */
    public void recordCascade(String operation, String outcome, int affectedRows) {
        registry.counter("inventory.cascade",
                "operation", sanitizeTag(operation),
                "outcome", sanitizeTag(outcome)
        ).increment();
        registry.summary("inventory.cascade.rows",
                "operation", sanitizeTag(operation)
        ).record(affectedRows);
    }

    public void recordReconciliationLatency(long durationMs) {
        registry.timer("inventory.reconciliation.latency").record(Duration.ofMillis(durationMs));
    }

    public void registerOrphanedTransactionsGauge(Supplier<Number> supplier) {
        registry.gauge("inventory.transactions.orphaned", Tags.empty(), supplier, s -> s.get().doubleValue());
    }

    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
