package com.flagship.stock_ledger.reconciliation;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Derived stock of one item: primary quantity and alternate-unit quantity.
 * Either may be negative when more has gone out than was recorded coming in.
 */
@Value
public class StockLevel {
    public static final StockLevel EMPTY = new StockLevel(BigDecimal.ZERO, BigDecimal.ZERO);

    BigDecimal quantity;
    BigDecimal altQuantity;

    StockLevel plus(BigDecimal quantityDelta, BigDecimal altQuantityDelta) {
        return new StockLevel(quantity.add(quantityDelta), altQuantity.add(altQuantityDelta));
    }
}
