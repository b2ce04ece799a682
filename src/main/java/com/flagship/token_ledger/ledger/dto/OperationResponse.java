package com.flagship.token_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Boolean result of a ledger operation. {@code false} only ever comes from a declined transfer.
 */
@Value
public class OperationResponse {

    @JsonProperty("success")
    boolean success;
}
