package com.flagship.stock_ledger.catalog;

import com.flagship.stock_ledger.consistency.CascadeFailureException;
import com.flagship.stock_ledger.consistency.CascadeFailureException.CascadeOperation;
import com.flagship.stock_ledger.consistency.ConsistencyMaintainer;
import com.flagship.stock_ledger.exception.ResourceNotFoundException;
import com.flagship.stock_ledger.observability.CorrelationContext;
import com.flagship.stock_ledger.observability.InventoryMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Catalog writes and their propagation into the ledger.
 *
 * The catalog write and the ledger cascade are two separate store operations.
 * update/delete are deliberately not {@code @Transactional}: the item change commits
 * on its own, the cascade runs in its own transaction afterwards, and a failed
 * cascade does not undo the item change.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CatalogService {

    private static final String RESOURCE_TYPE = "Item";

    private final ItemRepository itemRepository;
    private final ConsistencyMaintainer consistencyMaintainer;
    private final InventoryMetrics inventoryMetrics;

    @Transactional
    public Item createItem(String name, String unit, String altUnit, String factor, BigDecimal alertQty) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Item name is required");
        }
        if (unit == null || unit.isBlank()) {
            throw new IllegalArgumentException("Item unit is required");
        }

        Item item = Item.create(UUID.randomUUID(), name, unit, altUnit, factor, alertQty);
        Item saved = itemRepository.save(ItemEntity.fromDomain(item)).toDomain();

        inventoryMetrics.recordItemChanged("create");
        log.info("Item created: id={}, name='{}', unit={}, factor={}",
                saved.getId(), saved.getName(), saved.getUnit(), saved.getFactor());
        return saved;
    }

    @Transactional(readOnly = true)
    public Item getItem(UUID id) {
        return itemRepository.findById(id)
            .map(ItemEntity::toDomain)
            .orElseThrow(() -> new ResourceNotFoundException(RESOURCE_TYPE, id));
    }

    /**
     * Updates an item. When the name changes, every ledger row stored under the old
     * name is rewritten to the new one after the item itself has been saved.
     *
     * @throws ResourceNotFoundException if the item does not exist
     * @throws CascadeFailureException if the item was saved but the ledger rewrite failed
     */
    public Item updateItem(UUID id, String name, String unit, String altUnit, String factor, BigDecimal alertQty) {
        MDC.put(CorrelationContext.ITEM_ID_MDC_KEY, id.toString());
        try {
            ItemEntity entity = itemRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException(RESOURCE_TYPE, id));

            Item existing = entity.toDomain();
            Item changed = existing.withDetails(name, unit, altUnit, factor, alertQty);
            boolean renamed = existing.isRenamedTo(changed.getName());

            entity.updateFromDomain(changed);
            Item saved = itemRepository.save(entity).toDomain();
            inventoryMetrics.recordItemChanged("update");

            if (renamed) {
                log.info("Item renamed from '{}' to '{}', cascading to ledger", existing.getName(), saved.getName());
                cascadeRename(saved.getId(), existing.getName(), saved.getName());
            } else {
                log.info("Item updated: name='{}'", saved.getName());
            }
            return saved;
        } finally {
            MDC.remove(CorrelationContext.ITEM_ID_MDC_KEY);
        }
    }

    /**
     * Deletes an item and every ledger row stored under its name.
     *
     * Ledger rows go first: if that step fails the item is still in place and the
     * delete can simply be issued again.
     */
    public void deleteItem(UUID id) {
        MDC.put(CorrelationContext.ITEM_ID_MDC_KEY, id.toString());
        try {
            Item item = getItem(id);

            int removed = consistencyMaintainer.removeReferences(item.getName());
            try {
                itemRepository.deleteById(id);
            } catch (RuntimeException e) {
                inventoryMetrics.recordCascade("delete", "failure", removed);
                log.error("Item delete failed after its ledger rows were removed: name='{}', ledgerRowsRemoved={}, error={}",
                        item.getName(), removed, e.getMessage());
                throw new CascadeFailureException(id, CascadeOperation.DELETE, item.getName(), item.getName(), e);
            }

            inventoryMetrics.recordItemChanged("delete");
            log.info("Item deleted: name='{}', ledgerRowsRemoved={}", item.getName(), removed);
        } finally {
            MDC.remove(CorrelationContext.ITEM_ID_MDC_KEY);
        }
    }

    /**
     * Completes an interrupted rename: rows still stored under {@code previousName}
     * are pointed at the item's current name. Safe to call repeatedly.
     */
    public int retryRenameCascade(UUID id, String previousName) {
        Item item = getItem(id);
        int rewritten = consistencyMaintainer.renameReferences(previousName, item.getName());
        log.info("Rename cascade retried: from='{}', to='{}', rewritten={}", previousName, item.getName(), rewritten);
        return rewritten;
    }

    private void cascadeRename(UUID itemId, String oldName, String newName) {
        try {
            consistencyMaintainer.renameReferences(oldName, newName);
        } catch (RuntimeException e) {
            inventoryMetrics.recordCascade("rename", "failure", 0);
            log.error("Rename cascade failed after item was saved: from='{}', to='{}', error={}",
                    oldName, newName, e.getMessage());
            throw new CascadeFailureException(itemId, CascadeOperation.RENAME, oldName, newName, e);
        }
    }
}
