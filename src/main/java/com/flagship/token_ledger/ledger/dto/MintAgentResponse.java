package com.flagship.token_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class MintAgentResponse {

    @JsonProperty("address")
    String address;

    @JsonProperty("mint_agent")
    boolean mintAgent;
}
