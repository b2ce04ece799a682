package com.flagship.token_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.token_ledger.ledger.Address;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Value;

@Value
public class BurnFromRequest {

    @NotBlank(message = "Source is required")
    @Pattern(regexp = Address.PATTERN, message = "Source must be a 0x-prefixed 20-byte hex address")
    @JsonProperty("from")
    String from;

    @NotBlank(message = "Amount is required")
    @Pattern(regexp = AmountFormat.PATTERN, message = AmountFormat.MESSAGE)
    @JsonProperty("amount")
    String amount;
}
