package com.flagship.stock_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One recorded stock movement.
 *
 * {@code itemName} is the catalog name at the time of writing, not a stable key.
 * {@code quantity} is a non-negative magnitude; the sign comes from {@code type}.
 * {@code altQty} is kept as text because older rows carry values like "50 box".
 */
@Value
public class StockTransaction {
    UUID id;
    String date;
    MovementType type;
    String itemName;
    BigDecimal quantity;
    String altQty;
    String remarks;
    String unit;
    String altUnit;
    BigDecimal rate;
    Instant createdAt;
    Instant updatedAt;
}
