package com.flagship.stock_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.stock_ledger.ledger.MovementType;
import com.flagship.stock_ledger.ledger.StockTransaction;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class TransactionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("date")
    String date;

    @JsonProperty("type")
    MovementType type;

    @JsonProperty("itemName")
    String itemName;

    @JsonProperty("quantity")
    BigDecimal quantity;

    @JsonProperty("altQty")
    String altQty;

    @JsonProperty("remarks")
    String remarks;

    @JsonProperty("unit")
    String unit;

    @JsonProperty("altUnit")
    String altUnit;

    @JsonProperty("rate")
    BigDecimal rate;

    public static TransactionResponse from(StockTransaction transaction) {
        return TransactionResponse.builder()
            .id(transaction.getId())
            .date(transaction.getDate())
            .type(transaction.getType())
            .itemName(transaction.getItemName())
            .quantity(plain(transaction.getQuantity()))
            .altQty(transaction.getAltQty())
            .remarks(transaction.getRemarks())
            .unit(transaction.getUnit())
            .altUnit(transaction.getAltUnit())
            .rate(plain(transaction.getRate()))
            .build();
    }

    private static BigDecimal plain(BigDecimal value) {
        if (value == null) {
            return null;
        }
        return value.signum() == 0 ? BigDecimal.ZERO : value.stripTrailingZeros();
    }
}
