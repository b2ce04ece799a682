package com.flagship.token_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.token_ledger.ledger.Address;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Value;

/**
 * Request DTO for approve, increase and decrease of an allowance.
 * For increase/decrease, {@code value} is the delta.
 */
@Value
public class ApprovalRequest {

    @NotBlank(message = "Spender is required")
    @Pattern(regexp = Address.PATTERN, message = "Spender must be a 0x-prefixed 20-byte hex address")
    @JsonProperty("spender")
    String spender;

    @NotBlank(message = "Value is required")
    @Pattern(regexp = AmountFormat.PATTERN, message = AmountFormat.MESSAGE)
    @JsonProperty("value")
    String value;
}
