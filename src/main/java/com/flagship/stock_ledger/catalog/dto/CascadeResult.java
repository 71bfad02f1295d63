package com.flagship.stock_ledger.catalog.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class CascadeResult {

    @JsonProperty("message")
    String message;

    @JsonProperty("rewritten")
    int rewritten;
}
