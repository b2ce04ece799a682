package com.flagship.token_ledger.ledger;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Committed ledger state. Only {@link LedgerTransaction#commit()} writes to it.
 *
 * Zero balances and zero allowances are not stored.
 */
class LedgerState {

    final Map<Address, BigInteger> balances = new HashMap<>();
    final Map<AllowanceKey, BigInteger> allowances = new HashMap<>();
    final Set<Address> mintAgents = new HashSet<>();
    BigInteger totalSupply = BigInteger.ZERO;
    Address owner;

    LedgerState(Address owner) {
        this.owner = owner;
    }
}
