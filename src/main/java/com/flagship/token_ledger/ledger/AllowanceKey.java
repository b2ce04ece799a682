package com.flagship.token_ledger.ledger;

import lombok.Value;

/**
 * Map key for the allowance granted by {@code owner} to {@code spender}.
 */
@Value
class AllowanceKey {
    Address owner;
    Address spender;
}
