package com.flagship.stock_ledger.consistency;

import com.flagship.stock_ledger.ledger.StockTransactionRepository;
import com.flagship.stock_ledger.matching.NameMatcher;
import com.flagship.stock_ledger.observability.InventoryMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Keeps the ledger's name link valid when catalog names change or disappear.
 *
 * Both cascades are bulk statements matching the stored name exactly, run in their
 * own transaction, separate from the catalog write. They are idempotent: re-running
 * a completed cascade touches no rows.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConsistencyMaintainer {

    private final StockTransactionRepository transactionRepository;
    private final InventoryMetrics inventoryMetrics;

    /**
     * Points every row stored under {@code oldName} at {@code newName}.
     *
     * @return number of rows rewritten
     */
    @Transactional
    public int renameReferences(String oldName, String newName) {
        if (oldName == null || newName == null || oldName.equals(newName)) {
            return 0;
        }
        int rewritten = transactionRepository.renameItemReferences(
            oldName, newName, NameMatcher.normalize(newName));
        inventoryMetrics.recordCascade("rename", "success", rewritten);
        log.info("Rename cascade: {} ledger rows moved from '{}' to '{}'", rewritten, oldName, newName);
        return rewritten;
    }

    /**
     * Deletes every row stored under exactly {@code itemName}.
     *
     * @return number of rows deleted
     */
    @Transactional
    public int removeReferences(String itemName) {
        if (itemName == null) {
            return 0;
        }
        int removed = transactionRepository.deleteByItemNameExact(itemName);
        inventoryMetrics.recordCascade("delete", "success", removed);
        log.info("Delete cascade: {} ledger rows removed for '{}'", removed, itemName);
        return removed;
    }
}
