package com.flagship.token_ledger.ledger;

import lombok.Value;

/**
 * Descriptive token attributes, fixed when the ledger is created.
 */
@Value
public class TokenMetadata {
    String name;
    String symbol;
    int decimals;
}
