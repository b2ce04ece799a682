package com.flagship.token_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.token_ledger.ledger.Address;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Value;

/**
 * Request DTO for a transfer that spends the caller's allowance over {@code from}.
 */
@Value
public class TransferFromRequest {

    @NotBlank(message = "Source is required")
    @Pattern(regexp = Address.PATTERN, message = "Source must be a 0x-prefixed 20-byte hex address")
    @JsonProperty("from")
    String from;

    @NotBlank(message = "Recipient is required")
    @Pattern(regexp = Address.PATTERN, message = "Recipient must be a 0x-prefixed 20-byte hex address")
    @JsonProperty("to")
    String to;

    @NotBlank(message = "Value is required")
    @Pattern(regexp = AmountFormat.PATTERN, message = AmountFormat.MESSAGE)
    @JsonProperty("value")
    String value;
}
