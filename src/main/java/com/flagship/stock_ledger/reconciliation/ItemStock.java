package com.flagship.stock_ledger.reconciliation;

import com.flagship.stock_ledger.catalog.Item;
import lombok.Value;

/**
 * A catalog item together with its derived stock level.
 */
@Value
public class ItemStock {
    Item item;
    StockLevel level;

    public static ItemStock withoutHistory(Item item) {
        return new ItemStock(item, StockLevel.EMPTY);
    }
}
