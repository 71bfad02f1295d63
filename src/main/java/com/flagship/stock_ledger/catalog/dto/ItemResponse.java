package com.flagship.stock_ledger.catalog.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.stock_ledger.catalog.Item;
import com.flagship.stock_ledger.reconciliation.ItemStock;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Catalog item as returned by the API, with stock derived from the ledger.
 */
@Value
@Builder
public class ItemResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("name")
    String name;

    @JsonProperty("unit")
    String unit;

    @JsonProperty("altUnit")
    String altUnit;

    @JsonProperty("factor")
    String factor;

    @JsonProperty("alertQty")
    BigDecimal alertQty;

    @JsonProperty("quantity")
    BigDecimal quantity;

    @JsonProperty("altQuantity")
    BigDecimal altQuantity;

    public static ItemResponse from(ItemStock stock) {
        Item item = stock.getItem();
        return ItemResponse.builder()
            .id(item.getId())
            .name(item.getName())
            .unit(item.getUnit())
            .altUnit(item.getAltUnit())
            .factor(item.getFactor())
            .alertQty(plain(item.getAlertQty()))
            .quantity(plain(stock.getLevel().getQuantity()))
            .altQuantity(plain(stock.getLevel().getAltQuantity()))
            .build();
    }

    private static BigDecimal plain(BigDecimal value) {
        if (value == null || value.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return value.stripTrailingZeros();
    }
}
