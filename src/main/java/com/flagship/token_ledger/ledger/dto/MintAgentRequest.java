package com.flagship.token_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class MintAgentRequest {

    @NotNull(message = "Enabled flag is required")
    @JsonProperty("enabled")
    Boolean enabled;
}
