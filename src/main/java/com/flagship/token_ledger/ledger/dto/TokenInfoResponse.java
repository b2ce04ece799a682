package com.flagship.token_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

@Value
@Builder
public class TokenInfoResponse {

    @JsonProperty("name")
    String name;

    @JsonProperty("symbol")
    String symbol;

    @JsonProperty("decimals")
    int decimals;

    @JsonProperty("total_supply")
    BigInteger totalSupply;

    @JsonProperty("owner")
    String owner;
}
