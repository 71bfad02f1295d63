package com.flagship.stock_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.stock_ledger.reconciliation.QuantityParser;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Request body for recording or editing a stock movement.
 *
 * {@code type} is free text: it is normalized to IN/OUT and falls back to IN.
 * {@code altQty} accepts a number or text ("50", 50, "50 box"); when it is missing
 * or zero a value is derived from the item's factor before saving.
 */
@Value
public class TransactionRequest {

    @NotBlank(message = "Date is required")
    @JsonProperty("date")
    String date;

    @JsonProperty("type")
    String type;

    @NotBlank(message = "Item name is required")
    @JsonProperty("itemName")
    String itemName;

    @NotNull(message = "Quantity is required")
    @DecimalMin(value = "0", message = "Quantity must not be negative")
    @Digits(integer = 15, fraction = 4, message = "Quantity allows at most 15 integer and 4 fraction digits")
    @JsonProperty("quantity")
    BigDecimal quantity;

    @Size(max = 64, message = "Alternate quantity is too long")
    @JsonProperty("altQty")
    String altQty;

    @JsonProperty("remarks")
    String remarks;

    @JsonProperty("unit")
    String unit;

    @JsonProperty("altUnit")
    String altUnit;

    @Digits(integer = 15, fraction = 4, message = "Rate allows at most 15 integer and 4 fraction digits")
    @JsonProperty("rate")
    BigDecimal rate;

    @JsonIgnore
    @AssertTrue(message = "Alternate quantity is out of range")
    public boolean isAltQtyInRange() {
        return QuantityParser.isWithinRange(altQty);
    }
}
