package com.flagship.token_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigInteger;

@Value
public class AllowanceResponse {

    @JsonProperty("owner")
    String owner;

    @JsonProperty("spender")
    String spender;

    @JsonProperty("allowance")
    BigInteger allowance;
}
