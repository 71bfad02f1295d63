package com.flagship.stock_ledger.observability;

import com.flagship.stock_ledger.ledger.StockTransactionRepository;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Tracks ledger rows whose item name matches no catalog item.
 *
 * Orphans are not errors: they are retained and contribute to no item's stock. The
 * count is cached and refreshed by {@link MetricsScheduler} so scrapes never hit
 * the database.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OrphanReferenceMetrics {

    private final StockTransactionRepository transactionRepository;
    private final InventoryMetrics inventoryMetrics;

    private final AtomicLong orphanedCount = new AtomicLong(0);

    @PostConstruct
    void registerGauge() {
        inventoryMetrics.registerOrphanedTransactionsGauge(orphanedCount::get);
    }

    public void refreshMetrics() {
        try {
            long count = transactionRepository.countOrphaned();
            long previous = orphanedCount.getAndSet(count);
            if (count != previous) {
                log.info("Orphaned ledger rows: {} (was {})", count, previous);
            }
        } catch (Exception e) {
            log.warn("Failed to refresh orphaned transaction count: {}", e.getMessage());
        }
    }

    public long getOrphanedCount() {
        return orphanedCount.get();
    }
}
