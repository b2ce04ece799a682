package com.flagship.token_ledger.ledger;

import com.flagship.token_ledger.arithmetic.SafeMath;
import com.flagship.token_ledger.ledger.exception.LedgerException;
import com.flagship.token_ledger.observability.CorrelationContext;
import com.flagship.token_ledger.observability.LedgerMetrics;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.util.function.Supplier;

/**
 * Entry point for ledger operations coming from the API.
 *
 * Delegates every operation to the {@link TokenLedger} and adds what the ledger itself
 * does not care about: structured logging with the caller in MDC, outcome counters
 * and latency timers.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TokenLedgerService {

    private final TokenLedger tokenLedger;
    private final LedgerMetrics ledgerMetrics;

    @PostConstruct
    public void registerGauges() {
        BigDecimal unit = new BigDecimal(SafeMath.pow10(tokenLedger.getMetadata().getDecimals()));
        ledgerMetrics.registerTotalSupplyGauge(
            () -> new BigDecimal(tokenLedger.totalSupply()).divide(unit).doubleValue());
    }

    // ==================== Reads ====================

    public TokenMetadata getMetadata() {
        return tokenLedger.getMetadata();
    }

    public BigInteger totalSupply() {
        return tokenLedger.totalSupply();
    }

    public Address owner() {
        return tokenLedger.owner();
    }

    public BigInteger balanceOf(Address account) {
        return tokenLedger.balanceOf(account);
    }

    public BigInteger allowance(Address owner, Address spender) {
        return tokenLedger.allowance(owner, spender);
    }

    public boolean isMintAgent(Address account) {
        return tokenLedger.isMintAgent(account);
    }

    // ==================== Mutations ====================

    public boolean transfer(Address caller, Address to, BigInteger value) {
        boolean transferred = execute("transfer", caller, () -> tokenLedger.transfer(caller, to, value));
        if (transferred) {
            log.info("Transfer completed: from={}, to={}, value={}", caller, to, value);
        } else {
            log.info("Transfer declined: from={}, to={}, value={}", caller, to, value);
        }
        return transferred;
    }

    public boolean transferFrom(Address caller, Address from, Address to, BigInteger value) {
        boolean transferred = execute("transfer_from", caller,
            () -> tokenLedger.transferFrom(caller, from, to, value));
        log.info("Delegated transfer completed: spender={}, from={}, to={}, value={}", caller, from, to, value);
        return transferred;
    }

    public boolean approve(Address caller, Address spender, BigInteger value) {
        boolean approved = execute("approve", caller, () -> tokenLedger.approve(caller, spender, value));
        log.info("Allowance set: owner={}, spender={}, value={}", caller, spender, value);
        return approved;
    }

    public boolean increaseApproval(Address caller, Address spender, BigInteger addedValue) {
        boolean approved = execute("increase_approval", caller,
            () -> tokenLedger.increaseApproval(caller, spender, addedValue));
        log.info("Allowance increased: owner={}, spender={}, added={}", caller, spender, addedValue);
        return approved;
    }

    public boolean decreaseApproval(Address caller, Address spender, BigInteger subtractedValue) {
        boolean approved = execute("decrease_approval", caller,
            () -> tokenLedger.decreaseApproval(caller, spender, subtractedValue));
        log.info("Allowance decreased: owner={}, spender={}, subtracted={}", caller, spender, subtractedValue);
        return approved;
    }

    public void mint(Address caller, BigInteger amount) {
        execute("mint", caller, () -> {
            tokenLedger.mint(caller, amount);
            return true;
        });
        log.info("Minted: agent={}, amount={}", caller, amount);
    }

    public void burnFrom(Address caller, Address from, BigInteger amount) {
        execute("burn_from", caller, () -> {
            tokenLedger.burnFrom(caller, from, amount);
            return true;
        });
        log.info("Burned by owner: from={}, amount={}", from, amount);
    }

    public void burnSelf(Address caller, BigInteger amount) {
        execute("burn_self", caller, () -> {
            tokenLedger.burnSelf(caller, amount);
            return true;
        });
        log.info("Burned by agent: agent={}, amount={}", caller, amount);
    }

    public void transferOwnership(Address caller, Address newOwner) {
        execute("transfer_ownership", caller, () -> {
            tokenLedger.transferOwnership(caller, newOwner);
            return true;
        });
        log.info("Ownership transferred: previousOwner={}, newOwner={}", caller, newOwner);
    }

    public void setMintAgent(Address caller, Address agent, boolean enabled) {
        execute("set_mint_agent", caller, () -> {
            tokenLedger.setMintAgent(caller, agent, enabled);
            return true;
        });
        log.info("Mint agent changed: agent={}, enabled={}", agent, enabled);
    }

    /**
     * Runs one ledger operation with the caller in MDC, recording its outcome and latency.
     * A {@code false} result counts as declined, a ledger error as rejected.
     */
    private boolean execute(String operation, Address caller, Supplier<Boolean> call) {
        long startTime = System.nanoTime();
        MDC.put(CorrelationContext.CALLER_ADDRESS_MDC_KEY, String.valueOf(caller));
        try {
            boolean result = call.get();
            ledgerMetrics.recordOperation(operation,
                result ? LedgerMetrics.OUTCOME_SUCCESS : LedgerMetrics.OUTCOME_DECLINED);
            return result;
        } catch (LedgerException e) {
            log.warn("Ledger operation rejected: operation={}, errorCode={}, message={}",
                operation, e.getErrorCode(), e.getMessage());
            ledgerMetrics.recordOperation(operation, LedgerMetrics.OUTCOME_REJECTED);
            ledgerMetrics.recordRejection(operation, e.getErrorCode().name());
            throw e;
        } catch (RuntimeException e) {
            log.error("Ledger operation failed: operation={}, error={}", operation, e.getMessage(), e);
            ledgerMetrics.recordOperation(operation, LedgerMetrics.OUTCOME_ERROR);
            throw e;
        } finally {
            ledgerMetrics.recordLatency(operation, Duration.ofNanos(System.nanoTime() - startTime));
            MDC.remove(CorrelationContext.CALLER_ADDRESS_MDC_KEY);
        }
    }
}
