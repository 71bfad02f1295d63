package com.flagship.stock_ledger.reconciliation;

import com.flagship.stock_ledger.catalog.Item;
import com.flagship.stock_ledger.catalog.ItemEntity;
import com.flagship.stock_ledger.catalog.ItemRepository;
import com.flagship.stock_ledger.matching.NameMatcher;
import com.flagship.stock_ledger.observability.InventoryMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Read path of the catalog: every item with its stock derived from the ledger.
 *
 * Each item is reconciled independently on the reconciliation executor. The work
 * only reads, so items fan out freely; results are joined back in catalog order.
 */
@Service
@Slf4j
public class StockQueryService {

    private final ItemRepository itemRepository;
    private final NameMatcher nameMatcher;
    private final StockReconciler reconciler;
    private final Executor reconciliationExecutor;
    private final InventoryMetrics inventoryMetrics;

    public StockQueryService(ItemRepository itemRepository,
                             NameMatcher nameMatcher,
                             StockReconciler reconciler,
                             @Qualifier("reconciliationExecutor") Executor reconciliationExecutor,
                             InventoryMetrics inventoryMetrics) {
        this.itemRepository = itemRepository;
        this.nameMatcher = nameMatcher;
        this.reconciler = reconciler;
        this.reconciliationExecutor = reconciliationExecutor;
        this.inventoryMetrics = inventoryMetrics;
    }

    public List<ItemStock> listItemStock() {
        long startTime = System.currentTimeMillis();

        List<Item> items = itemRepository.findAllByOrderByCreatedAtAscIdAsc()
            .stream()
            .map(ItemEntity::toDomain)
            .toList();

        List<CompletableFuture<ItemStock>> pending = items.stream()
            .map(item -> CompletableFuture.supplyAsync(() -> stockOf(item), reconciliationExecutor))
            .toList();

        List<ItemStock> result = pending.stream()
            .map(CompletableFuture::join)
            .toList();

        long duration = System.currentTimeMillis() - startTime;
        inventoryMetrics.recordReconciliationLatency(duration);
        log.debug("Reconciled {} items in {}ms", result.size(), duration);

        return result;
    }

    /**
     * Derives the stock of a single item from its matched transactions.
     */
    public ItemStock stockOf(Item item) {
        StockLevel level = reconciler.reconcile(nameMatcher.findTransactionsFor(item.getName()));
        return new ItemStock(item, level);
    }
}
