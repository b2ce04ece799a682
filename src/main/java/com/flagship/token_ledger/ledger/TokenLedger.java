package com.flagship.token_ledger.ledger;

import com.flagship.token_ledger.arithmetic.SafeMath;
import com.flagship.token_ledger.ledger.event.ApprovalEvent;
import com.flagship.token_ledger.ledger.event.BurnEvent;
import com.flagship.token_ledger.ledger.event.MintAgentChangedEvent;
import com.flagship.token_ledger.ledger.event.MintEvent;
import com.flagship.token_ledger.ledger.event.TransferEvent;
import com.flagship.token_ledger.ledger.exception.LedgerException;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Fungible token ledger: balances, allowances, total supply, owner and mint agents.
 *
 * This class enforces the core invariants:
 * 1. The sum of all balances equals the total supply
 * 2. Every operation is all-or-nothing: a rejected operation changes nothing and emits nothing
 * 3. Operations are serialized: one exclusive lock guards the whole state
 *
 * The caller of every mutating operation is passed explicitly; authenticating it is the
 * job of whatever layer sits in front of the ledger.
 */
public class TokenLedger {

    private final TokenMetadata metadata;
    private final LedgerState state;
    private final TokenEventSink eventSink;
    private final ReentrantLock lock = new ReentrantLock(true);

    private TokenLedger(TokenMetadata metadata, LedgerState state, TokenEventSink eventSink) {
        this.metadata = metadata;
        this.state = state;
        this.eventSink = eventSink;
    }

    /**
     * Creates a ledger whose whole initial supply belongs to {@code creator}.
     *
     * The creator becomes the owner and the only mint agent.
     *
     * @param initialSupply supply in whole units, scaled by {@code 10^decimals}
     */
    public static TokenLedger create(TokenMetadata metadata, Address creator,
                                     BigInteger initialSupply, TokenEventSink eventSink) {
        Objects.requireNonNull(metadata, "metadata");
        Objects.requireNonNull(eventSink, "eventSink");
        requireAddress(creator, "creator");
        if (creator.isZero()) {
            throw LedgerException.invalidArgument("Creator cannot be the zero address");
        }
        if (metadata.getDecimals() < 0) {
            throw LedgerException.invalidArgument("Decimals must not be negative: " + metadata.getDecimals());
        }
        BigInteger supply = SafeMath.mul(
            SafeMath.requireAmount(initialSupply, "initialSupply"),
            SafeMath.pow10(metadata.getDecimals()));

        LedgerState state = new LedgerState(creator);
        state.totalSupply = supply;
        if (supply.signum() > 0) {
            state.balances.put(creator, supply);
        }
        state.mintAgents.add(creator);
        return new TokenLedger(metadata, state, eventSink);
    }

    // ==================== Reads ====================

    public TokenMetadata getMetadata() {
        return metadata;
    }

    public BigInteger balanceOf(Address account) {
        requireAddress(account, "account");
        return read(tx -> tx.balanceOf(account));
    }

    public BigInteger allowance(Address owner, Address spender) {
        requireAddress(owner, "owner");
        requireAddress(spender, "spender");
        return read(tx -> tx.allowance(owner, spender));
    }

    public BigInteger totalSupply() {
        return read(LedgerTransaction::totalSupply);
    }

    public Address owner() {
        return read(LedgerTransaction::owner);
    }

    public boolean isMintAgent(Address account) {
        requireAddress(account, "account");
        return read(tx -> tx.isMintAgent(account));
    }

    /**
     * Copy of every non-zero balance, taken atomically.
     */
    public Map<Address, BigInteger> balances() {
        lock.lock();
        try {
            return new HashMap<>(state.balances);
        } finally {
            lock.unlock();
        }
    }

    // ==================== Transfers ====================

    /**
     * Moves {@code value} from the caller to {@code to}.
     *
     * An insufficient balance or a zero value is not an error: the call returns {@code false},
     * changes nothing and emits nothing.
     *
     * @throws LedgerException INVALID_ARGUMENT if {@code to} is the zero address
     */
    public boolean transfer(Address caller, Address to, BigInteger value) {
        requireCaller(caller);
        requireAddress(to, "to");
        SafeMath.requireAmount(value, "value");
        if (to.isZero()) {
            throw LedgerException.invalidArgument("Cannot transfer to the zero address");
        }

        return execute(tx -> {
            BigInteger fromBalance = tx.balanceOf(caller);
            if (value.signum() == 0 || fromBalance.compareTo(value) < 0) {
                return false;
            }
            tx.setBalance(caller, SafeMath.sub(fromBalance, value));
            tx.setBalance(to, SafeMath.add(tx.balanceOf(to), value));
            tx.emit(TransferEvent.of(caller, to, value));
            return true;
        });
    }

    /**
     * Moves {@code value} from {@code from} to {@code to}, spending the caller's allowance.
     *
     * Unlike {@link #transfer}, missing funds or allowance abort the call.
     *
     * @return always {@code true}
     * @throws LedgerException INVALID_ARGUMENT, INSUFFICIENT_BALANCE or INSUFFICIENT_ALLOWANCE
     */
    public boolean transferFrom(Address caller, Address from, Address to, BigInteger value) {
        requireCaller(caller);
        requireAddress(from, "from");
        requireAddress(to, "to");
        SafeMath.requireAmount(value, "value");
        if (to.isZero()) {
            throw LedgerException.invalidArgument("Cannot transfer to the zero address");
        }

        return execute(tx -> {
            BigInteger fromBalance = tx.balanceOf(from);
            if (value.compareTo(fromBalance) > 0) {
                throw LedgerException.insufficientBalance(
                    String.format("Balance of %s is %s, cannot move %s", from, fromBalance, value));
            }
            BigInteger allowance = tx.allowance(from, caller);
            if (value.compareTo(allowance) > 0) {
                throw LedgerException.insufficientAllowance(
                    String.format("Allowance of %s over %s is %s, cannot move %s", caller, from, allowance, value));
            }
            tx.setBalance(to, SafeMath.add(tx.balanceOf(to), value));
            tx.setBalance(from, SafeMath.sub(tx.balanceOf(from), value));
            tx.setAllowance(from, caller, SafeMath.sub(allowance, value));
            tx.emit(TransferEvent.of(from, to, value));
            return true;
        });
    }

    // ==================== Allowances ====================

    /**
     * Sets the allowance of {@code spender} over the caller's balance.
     *
     * A non-zero allowance can only replace a zero one; callers must reset it to zero first.
     *
     * @throws LedgerException ALLOWANCE_RACE_CONDITION if both the current and the new value are non-zero
     */
    public boolean approve(Address caller, Address spender, BigInteger value) {
        requireCaller(caller);
        requireSpender(spender);
        SafeMath.requireAmount(value, "value");

        return execute(tx -> {
            BigInteger current = tx.allowance(caller, spender);
            if (value.signum() != 0 && current.signum() != 0) {
                throw LedgerException.allowanceRaceCondition(
                    String.format("Allowance of %s is already %s; set it to 0 before approving %s",
                        spender, current, value));
            }
            tx.setAllowance(caller, spender, value);
            tx.emit(ApprovalEvent.of(caller, spender, value));
            return true;
        });
    }

    public boolean increaseApproval(Address caller, Address spender, BigInteger addedValue) {
        requireCaller(caller);
        requireSpender(spender);
        SafeMath.requireAmount(addedValue, "addedValue");

        return execute(tx -> {
            BigInteger updated = SafeMath.add(tx.allowance(caller, spender), addedValue);
            tx.setAllowance(caller, spender, updated);
            tx.emit(ApprovalEvent.of(caller, spender, updated));
            return true;
        });
    }

    /**
     * Lowers the allowance of {@code spender}, clamping at zero.
     */
    public boolean decreaseApproval(Address caller, Address spender, BigInteger subtractedValue) {
        requireCaller(caller);
        requireSpender(spender);
        SafeMath.requireAmount(subtractedValue, "subtractedValue");

        return execute(tx -> {
            BigInteger current = tx.allowance(caller, spender);
            BigInteger updated = subtractedValue.compareTo(current) > 0
                ? BigInteger.ZERO
                : SafeMath.sub(current, subtractedValue);
            tx.setAllowance(caller, spender, updated);
            tx.emit(ApprovalEvent.of(caller, spender, updated));
            return true;
        });
    }

    // ==================== Supply ====================

    /**
     * Creates {@code amount} new tokens on the caller's own balance.
     *
     * @throws LedgerException UNAUTHORIZED if the caller is not a mint agent
     */
    public void mint(Address caller, BigInteger amount) {
        requireCaller(caller);
        SafeMath.requireAmount(amount, "amount");

        execute(tx -> {
            requireMintAgent(tx, caller);
            tx.setTotalSupply(SafeMath.add(tx.totalSupply(), amount));
            tx.setBalance(caller, SafeMath.add(tx.balanceOf(caller), amount));
            tx.emit(TransferEvent.of(Address.ZERO, caller, amount));
            tx.emit(MintEvent.of(caller, amount));
            return null;
        });
    }

    /**
     * Destroys {@code amount} tokens held by {@code from}. Owner only.
     *
     * @throws LedgerException UNAUTHORIZED if the caller is not the owner,
     *                         INVALID_ARGUMENT if the amount is zero or exceeds the balance
     */
    public void burnFrom(Address caller, Address from, BigInteger amount) {
        requireCaller(caller);
        requireAddress(from, "from");
        SafeMath.requireAmount(amount, "amount");

        execute(tx -> {
            requireOwner(tx, caller);
            burn(tx, from, amount);
            return null;
        });
    }

    /**
     * Destroys {@code amount} tokens from the caller's own balance. Mint agents only.
     *
     * @throws LedgerException UNAUTHORIZED if the caller is not a mint agent,
     *                         INVALID_ARGUMENT if the amount is zero or exceeds the balance
     */
    public void burnSelf(Address caller, BigInteger amount) {
        requireCaller(caller);
        SafeMath.requireAmount(amount, "amount");

        execute(tx -> {
            requireMintAgent(tx, caller);
            burn(tx, caller, amount);
            return null;
        });
    }

    private static void burn(LedgerTransaction tx, Address from, BigInteger amount) {
        BigInteger balance = tx.balanceOf(from);
        if (amount.signum() == 0 || balance.compareTo(amount) < 0) {
            throw LedgerException.invalidArgument(
                String.format("Cannot burn %s from %s holding %s", amount, from, balance));
        }
        tx.setBalance(from, SafeMath.sub(balance, amount));
        tx.setTotalSupply(SafeMath.sub(tx.totalSupply(), amount));
        tx.emit(TransferEvent.of(from, Address.ZERO, amount));
        tx.emit(BurnEvent.of(from, amount));
    }

    // ==================== Access control ====================

    /**
     * Hands administrative authority to {@code newOwner}. Mint agent membership is not touched.
     */
    public void transferOwnership(Address caller, Address newOwner) {
        requireCaller(caller);
        requireAddress(newOwner, "newOwner");

        execute(tx -> {
            requireOwner(tx, caller);
            if (newOwner.isZero()) {
                throw LedgerException.invalidArgument("New owner cannot be the zero address");
            }
            if (newOwner.equals(tx.owner())) {
                throw LedgerException.invalidArgument("New owner must differ from the current owner");
            }
            tx.setOwner(newOwner);
            return null;
        });
    }

    /**
     * Grants or revokes mint agent status. Always notifies, even when membership is unchanged.
     */
    public void setMintAgent(Address caller, Address agent, boolean enabled) {
        requireCaller(caller);
        requireAddress(agent, "agent");

        execute(tx -> {
            requireOwner(tx, caller);
            if (agent.isZero()) {
                throw LedgerException.invalidArgument("Mint agent cannot be the zero address");
            }
            tx.setMintAgent(agent, enabled);
            tx.emit(MintAgentChangedEvent.of(agent, enabled));
            return null;
        });
    }

    private static void requireOwner(LedgerTransaction tx, Address caller) {
        if (!caller.equals(tx.owner())) {
            throw LedgerException.unauthorized(caller + " is not the owner");
        }
    }

    private static void requireMintAgent(LedgerTransaction tx, Address caller) {
        if (!tx.isMintAgent(caller)) {
            throw LedgerException.unauthorized(caller + " is not a mint agent");
        }
    }

    // ==================== Execution ====================

    private <T> T read(Function<LedgerTransaction, T> query) {
        lock.lock();
        try {
            return query.apply(new LedgerTransaction(state));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs an operation under the ledger lock.
     * Events go to the sink before the writes are applied, so a failing sink aborts the operation.
     */
    private <T> T execute(Function<LedgerTransaction, T> operation) {
        lock.lock();
        try {
            LedgerTransaction tx = new LedgerTransaction(state);
            T result = operation.apply(tx);
            if (!tx.events().isEmpty()) {
                eventSink.append(tx.events());
            }
            tx.commit();
            return result;
        } finally {
            lock.unlock();
        }
    }

    private static void requireCaller(Address caller) {
        requireAddress(caller, "caller");
        if (caller.isZero()) {
            throw LedgerException.unauthorized("The zero address cannot act on the ledger");
        }
    }

    private static void requireSpender(Address spender) {
        requireAddress(spender, "spender");
        if (spender.isZero()) {
            throw LedgerException.invalidArgument("Spender cannot be the zero address");
        }
    }

    private static void requireAddress(Address address, String name) {
        if (address == null) {
            throw LedgerException.invalidArgument(name + " is required");
        }
    }
}
