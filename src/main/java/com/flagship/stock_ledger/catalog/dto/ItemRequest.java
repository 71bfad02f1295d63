package com.flagship.stock_ledger.catalog.dto;

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
 * Request body for creating or updating a catalog item.
 * {@code altUnit} defaults to "-" and {@code factor} to "Manual" when omitted.
 */
@Value
public class ItemRequest {

    @NotBlank(message = "Name is required")
    @JsonProperty("name")
    String name;

    @NotBlank(message = "Unit is required")
    @JsonProperty("unit")
    String unit;

    @JsonProperty("altUnit")
    String altUnit;

    @Size(max = 64, message = "Factor is too long")
    @JsonProperty("factor")
    String factor;

    @NotNull(message = "Alert quantity is required")
    @DecimalMin(value = "0", message = "Alert quantity must not be negative")
    @Digits(integer = 15, fraction = 4, message = "Alert quantity allows at most 15 integer and 4 fraction digits")
    @JsonProperty("alertQty")
    BigDecimal alertQty;

    @JsonIgnore
    @AssertTrue(message = "Factor is out of range")
    public boolean isFactorInRange() {
        return QuantityParser.isWithinRange(factor);
    }
}
