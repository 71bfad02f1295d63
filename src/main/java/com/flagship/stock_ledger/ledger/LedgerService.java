package com.flagship.stock_ledger.ledger;

import com.flagship.stock_ledger.exception.ResourceNotFoundException;
import com.flagship.stock_ledger.ledger.dto.TransactionRequest;
import com.flagship.stock_ledger.observability.CorrelationContext;
import com.flagship.stock_ledger.observability.InventoryMetrics;
import com.flagship.stock_ledger.reconciliation.AltQuantityFiller;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Write and list operations on the movement ledger.
 *
 * Rows are accepted whether or not their item name exists in the catalog; an
 * unmatched row simply contributes to no item's stock. The alternate quantity is
 * filled before every create and update.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {

    private static final String RESOURCE_TYPE = "Transaction";

    private final StockTransactionRepository transactionRepository;
    private final AltQuantityFiller altQuantityFiller;
    private final InventoryMetrics inventoryMetrics;

    /**
     * All rows, newest date first; rows sharing a date keep storage order.
     */
    @Transactional(readOnly = true)
    public List<StockTransaction> listTransactions() {
        return transactionRepository.findAll(StockTransactionRepository.LISTING_ORDER)
            .stream()
            .map(StockTransactionEntity::toDomain)
            .toList();
    }

    @Transactional
    public StockTransaction recordTransaction(TransactionRequest request) {
        StockTransaction transaction = toDomain(UUID.randomUUID(), request);
        MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, transaction.getId().toString());
        try {
            StockTransaction saved = transactionRepository.save(StockTransactionEntity.fromDomain(transaction))
                .toDomain();

            inventoryMetrics.recordTransactionWritten("create", saved.getType().name());
            log.info("Transaction recorded: item='{}', type={}, quantity={}, altQty={}",
                    saved.getItemName(), saved.getType(), saved.getQuantity(), saved.getAltQty());
            return saved;
        } finally {
            MDC.remove(CorrelationContext.TRANSACTION_ID_MDC_KEY);
        }
    }

    /**
     * Replaces the editable fields of a row, re-running the alternate quantity fill
     * against the submitted values.
     */
    @Transactional
    public StockTransaction updateTransaction(UUID id, TransactionRequest request) {
        MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, id.toString());
        try {
            StockTransactionEntity entity = transactionRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException(RESOURCE_TYPE, id));

            entity.updateFromDomain(toDomain(id, request));
            StockTransaction saved = transactionRepository.save(entity).toDomain();

            inventoryMetrics.recordTransactionWritten("update", saved.getType().name());
            log.info("Transaction updated: item='{}', type={}, quantity={}, altQty={}",
                    saved.getItemName(), saved.getType(), saved.getQuantity(), saved.getAltQty());
            return saved;
        } finally {
            MDC.remove(CorrelationContext.TRANSACTION_ID_MDC_KEY);
        }
    }

    @Transactional
    public void deleteTransaction(UUID id) {
        if (!transactionRepository.existsById(id)) {
            throw new ResourceNotFoundException(RESOURCE_TYPE, id);
        }
        transactionRepository.deleteById(id);
        inventoryMetrics.recordTransactionWritten("delete", "n_a");
        log.info("Transaction deleted: id={}", id);
    }

    private StockTransaction toDomain(UUID id, TransactionRequest request) {
        if (request.getQuantity() != null && request.getQuantity().signum() < 0) {
            throw new IllegalArgumentException("Quantity must not be negative");
        }
        String itemName = request.getItemName();
        String altQty = altQuantityFiller.fill(itemName, request.getQuantity(), request.getAltQty());

        return new StockTransaction(
            id,
            request.getDate().strip(),
            MovementType.parse(request.getType()),
            itemName,
            request.getQuantity(),
            altQty,
            request.getRemarks(),
            request.getUnit(),
            request.getAltUnit(),
            request.getRate(),
            null,
            null
        );
    }
}
