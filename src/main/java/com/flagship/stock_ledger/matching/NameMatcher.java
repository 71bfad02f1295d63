package com.flagship.stock_ledger.matching;

import com.flagship.stock_ledger.catalog.Item;
import com.flagship.stock_ledger.catalog.ItemRepository;
import com.flagship.stock_ledger.catalog.ItemEntity;
import com.flagship.stock_ledger.ledger.StockTransaction;
import com.flagship.stock_ledger.ledger.StockTransactionEntity;
import com.flagship.stock_ledger.ledger.StockTransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Resolves the free-text item name carried by ledger rows to catalog items.
 *
 * Matching policy: both sides are trimmed and lower-cased, then compared as whole
 * strings. "Rice" matches " rice " but never "Basmati Rice". The normalized form is
 * stored in an indexed column on both tables, so lookups are plain equality and
 * characters such as '.', '*' or '$' are always literal.
 *
 * Two catalog items with the same normalized name see the same transactions.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NameMatcher {

    private final StockTransactionRepository transactionRepository;
    private final ItemRepository itemRepository;

    /**
     * Normalized form used as the join key between items and transactions.
     */
    public static String normalize(String name) {
        if (name == null) {
            return "";
        }
        return name.strip().toLowerCase(Locale.ROOT);
    }

    /**
     * Returns every transaction that belongs to the given item name.
     * An empty list is a valid outcome.
     */
    @Transactional(readOnly = true)
    public List<StockTransaction> findTransactionsFor(String itemName) {
        String key = normalize(itemName);
        if (key.isEmpty()) {
            return List.of();
        }
        List<StockTransaction> matched = transactionRepository.findByNormalizedItemName(key)
            .stream()
            .map(StockTransactionEntity::toDomain)
            .toList();
        log.debug("Matched {} transactions for item name '{}'", matched.size(), key);
        return matched;
    }

    /**
     * Finds the catalog item a transaction name refers to.
     * With duplicate names the earliest created item wins.
     */
    @Transactional(readOnly = true)
    public Optional<Item> findItemByName(String transactionItemName) {
        String key = normalize(transactionItemName);
        if (key.isEmpty()) {
            return Optional.empty();
        }
        return itemRepository.findFirstByNormalizedNameOrderByCreatedAtAscIdAsc(key)
            .map(ItemEntity::toDomain);
    }
}
