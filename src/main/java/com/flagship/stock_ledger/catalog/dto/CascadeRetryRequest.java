package com.flagship.stock_ledger.catalog.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

/**
 * Re-runs an interrupted rename cascade from {@code previousName} to the item's current name.
 */
@Value
public class CascadeRetryRequest {

    @NotBlank(message = "Previous name is required")
    @JsonProperty("previousName")
    String previousName;
}
