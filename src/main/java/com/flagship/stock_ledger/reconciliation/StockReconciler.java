package com.flagship.stock_ledger.reconciliation;

import com.flagship.stock_ledger.ledger.StockTransaction;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Collection;

/**
 * Folds an item's matched transactions into its current stock level.
 *
 * Alternate quantity uses the summed-history strategy: each row's recorded
 * {@code altQty} is signed by movement type and summed, exactly like the primary
 * quantity. The catalog factor is never consulted here; rows written without an
 * alternate figure had one materialized by {@link AltQuantityFiller}.
 *
 * The fold is a plain sum, so input order does not matter.
 */
@Component
public class StockReconciler {

    public StockLevel reconcile(Collection<StockTransaction> transactions) {
        StockLevel level = StockLevel.EMPTY;
        if (transactions == null) {
            return level;
        }
        for (StockTransaction transaction : transactions) {
            BigDecimal sign = BigDecimal.valueOf(transaction.getType().sign());
            BigDecimal quantity = QuantityParser.toQuantity(transaction.getQuantity());
            BigDecimal altQuantity = QuantityParser.toQuantity(transaction.getAltQty());
            level = level.plus(quantity.multiply(sign), altQuantity.multiply(sign));
        }
        return level;
    }
}
