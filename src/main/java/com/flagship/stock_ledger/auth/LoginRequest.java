package com.flagship.stock_ledger.auth;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class LoginRequest {

    @JsonProperty("username")
    String username;

    @JsonProperty("password")
    String password;
}
