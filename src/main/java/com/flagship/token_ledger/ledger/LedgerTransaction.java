package com.flagship.token_ledger.ledger;

import com.flagship.token_ledger.ledger.event.TokenEvent;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Write overlay for a single ledger operation.
 *
 * Reads see the operation's own staged writes first, then the committed state.
 * Nothing reaches {@link LedgerState} until {@link #commit()}; an operation that throws
 * simply drops its transaction, which leaves the committed state untouched.
 */
class LedgerTransaction {

    private final LedgerState state;

    private final Map<Address, BigInteger> balanceWrites = new LinkedHashMap<>();
    private final Map<AllowanceKey, BigInteger> allowanceWrites = new LinkedHashMap<>();
    private final Map<Address, Boolean> mintAgentWrites = new LinkedHashMap<>();
    private final List<TokenEvent> events = new ArrayList<>();
    private BigInteger totalSupplyWrite;
    private Address ownerWrite;

    LedgerTransaction(LedgerState state) {
        this.state = state;
    }

    BigInteger balanceOf(Address account) {
        BigInteger staged = balanceWrites.get(account);
        if (staged != null) {
            return staged;
        }
        return state.balances.getOrDefault(account, BigInteger.ZERO);
    }

    void setBalance(Address account, BigInteger value) {
        balanceWrites.put(account, value);
    }

    BigInteger allowance(Address owner, Address spender) {
        AllowanceKey key = new AllowanceKey(owner, spender);
        BigInteger staged = allowanceWrites.get(key);
        if (staged != null) {
            return staged;
        }
        return state.allowances.getOrDefault(key, BigInteger.ZERO);
    }

    void setAllowance(Address owner, Address spender, BigInteger value) {
        allowanceWrites.put(new AllowanceKey(owner, spender), value);
    }

    BigInteger totalSupply() {
        return totalSupplyWrite != null ? totalSupplyWrite : state.totalSupply;
    }

    void setTotalSupply(BigInteger value) {
        totalSupplyWrite = value;
    }

    Address owner() {
        return ownerWrite != null ? ownerWrite : state.owner;
    }

    void setOwner(Address newOwner) {
        ownerWrite = newOwner;
    }

    boolean isMintAgent(Address account) {
        Boolean staged = mintAgentWrites.get(account);
        if (staged != null) {
            return staged;
        }
        return state.mintAgents.contains(account);
    }

    void setMintAgent(Address account, boolean enabled) {
        mintAgentWrites.put(account, enabled);
    }

    void emit(TokenEvent event) {
        events.add(event);
    }

    List<TokenEvent> events() {
        return Collections.unmodifiableList(events);
    }

    /**
     * Applies every staged write to the committed state.
     */
    void commit() {
        balanceWrites.forEach((account, value) -> {
            if (value.signum() == 0) {
                state.balances.remove(account);
            } else {
                state.balances.put(account, value);
            }
        });
        allowanceWrites.forEach((key, value) -> {
            if (value.signum() == 0) {
                state.allowances.remove(key);
            } else {
                state.allowances.put(key, value);
            }
        });
        mintAgentWrites.forEach((account, enabled) -> {
            if (enabled) {
                state.mintAgents.add(account);
            } else {
                state.mintAgents.remove(account);
            }
        });
        if (totalSupplyWrite != null) {
            state.totalSupply = totalSupplyWrite;
        }
        if (ownerWrite != null) {
            state.owner = ownerWrite;
        }
    }
}
