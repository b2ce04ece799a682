package com.flagship.token_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.token_ledger.ledger.Address;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Value;

@Value
public class OwnershipRequest {

    @NotBlank(message = "New owner is required")
    @Pattern(regexp = Address.PATTERN, message = "New owner must be a 0x-prefixed 20-byte hex address")
    @JsonProperty("new_owner")
    String newOwner;
}
