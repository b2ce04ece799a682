package com.flagship.token_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Value;

/**
 * Request DTO for mint and self-burn.
 */
@Value
public class AmountRequest {

    @NotBlank(message = "Amount is required")
    @Pattern(regexp = AmountFormat.PATTERN, message = AmountFormat.MESSAGE)
    @JsonProperty("amount")
    String amount;
}
