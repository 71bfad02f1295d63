package com.flagship.stock_ledger.catalog;

import com.flagship.stock_ledger.reconciliation.ConversionFactor;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Catalog entry describing a stock-keeping unit and its unit conversion.
 *
 * {@code name} is the business key the ledger refers to. There is no database
 * constraint on its uniqueness.
 */
@Value
public class Item {
    public static final String NO_ALT_UNIT = "-";

    UUID id;
    String name;
    String unit;
    String altUnit;
    String factor;
    BigDecimal alertQty;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates a new catalog item, applying the defaults for the optional fields.
     */
    public static Item create(UUID id, String name, String unit, String altUnit,
                              String factor, BigDecimal alertQty) {
        Instant now = Instant.now();
        return new Item(
            id,
            name.strip(),
            unit.strip(),
            defaultIfBlank(altUnit, NO_ALT_UNIT),
            defaultIfBlank(factor, ConversionFactor.MANUAL),
            alertQty != null ? alertQty : BigDecimal.ZERO,
            now,
            now
        );
    }

    /**
     * Returns a copy carrying the submitted fields; identity and creation time are kept.
     */
    public Item withDetails(String name, String unit, String altUnit, String factor, BigDecimal alertQty) {
        return new Item(
            this.id,
            name.strip(),
            unit.strip(),
            defaultIfBlank(altUnit, NO_ALT_UNIT),
            defaultIfBlank(factor, ConversionFactor.MANUAL),
            alertQty != null ? alertQty : BigDecimal.ZERO,
            this.createdAt,
            Instant.now()
        );
    }

    public ConversionFactor conversionFactor() {
        return ConversionFactor.parse(factor);
    }

    public boolean isRenamedTo(String newName) {
        return newName != null && !name.equals(newName.strip());
    }

    private static String defaultIfBlank(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.strip();
    }
}
