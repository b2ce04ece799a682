package com.flagship.token_ledger.ledger;

import com.flagship.token_ledger.ledger.event.TokenEvent;
import com.flagship.token_ledger.ledger.event.TransferEvent;
import com.flagship.token_ledger.ledger.exception.LedgerErrorCode;
import com.flagship.token_ledger.ledger.exception.LedgerException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Concurrent callers against a single ledger.
 *
 * Operations are serialized, so however the threads interleave the final state must be
 * one that some sequential order of the same operations would produce.
 */
class TokenLedgerConcurrencyTest {

    private static final Address CREATOR = Address.of("0x00000000000000000000000000000000000000c0");
    private static final Address SPENDER = Address.of("0x00000000000000000000000000000000000000d0");
    private static final Address SINK = Address.of("0x00000000000000000000000000000000000000e0");

    private static Address holder(int index) {
        return Address.of(String.format("0x%040x", 0x1000 + index));
    }

    private static void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private static void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @Test
    @DisplayName("Concurrent transfers keep the supply intact and emit one notification each")
    void testConcurrentTransfers() throws InterruptedException {
        printTestHeader("Concurrent Transfers");

        List<TokenEvent> events = Collections.synchronizedList(new ArrayList<>());
        TokenLedger ledger = TokenLedger.create(new TokenMetadata("T", "T", 0),
            CREATOR, BigInteger.valueOf(10_000), events::addAll);

        int threads = 10;
        int transfersPerThread = 100;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger succeeded = new AtomicInteger();

        for (int t = 0; t < threads; t++) {
            Address recipient = holder(t);
            executor.submit(() -> {
                try {
                    start.await();
                    for (int i = 0; i < transfersPerThread; i++) {
                        if (ledger.transfer(CREATOR, recipient, BigInteger.ONE)) {
                            succeeded.incrementAndGet();
                        }
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }

        start.countDown();
        assertTrue(done.await(30, TimeUnit.SECONDS), "Workers should finish");
        executor.shutdown();

        assertEquals(threads * transfersPerThread, succeeded.get());
        assertEquals(BigInteger.valueOf(10_000 - threads * transfersPerThread), ledger.balanceOf(CREATOR));
        for (int t = 0; t < threads; t++) {
            assertEquals(BigInteger.valueOf(transfersPerThread), ledger.balanceOf(holder(t)));
        }
        assertEquals(threads * transfersPerThread, events.size());
        assertSupplyInvariant(ledger);

        printSuccess("All " + succeeded.get() + " transfers applied exactly once");
    }

    @Test
    @DisplayName("Racing transfers cannot overdraw a balance")
    void testNoOverdraft() throws InterruptedException {
        printTestHeader("No Overdraft Under Contention");

        TokenLedger ledger = TokenLedger.create(new TokenMetadata("T", "T", 0),
            CREATOR, BigInteger.valueOf(50), batch -> { });

        int threads = 20;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger succeeded = new AtomicInteger();
        AtomicInteger declined = new AtomicInteger();

        for (int t = 0; t < threads; t++) {
            Address recipient = holder(t);
            executor.submit(() -> {
                try {
                    start.await();
                    if (ledger.transfer(CREATOR, recipient, BigInteger.TEN)) {
                        succeeded.incrementAndGet();
                    } else {
                        declined.incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }

        start.countDown();
        assertTrue(done.await(30, TimeUnit.SECONDS), "Workers should finish");
        executor.shutdown();

        System.out.println("Succeeded: " + succeeded.get() + ", declined: " + declined.get());
        assertEquals(5, succeeded.get());
        assertEquals(15, declined.get());
        assertEquals(BigInteger.ZERO, ledger.balanceOf(CREATOR));
        assertSupplyInvariant(ledger);

        printSuccess("Balance drained exactly once");
    }

    @Test
    @DisplayName("Concurrent spenders never move more than the approved allowance")
    void testConcurrentTransferFrom() throws InterruptedException {
        printTestHeader("Concurrent transferFrom Against One Allowance");

        List<TokenEvent> events = Collections.synchronizedList(new ArrayList<>());
        TokenLedger ledger = TokenLedger.create(new TokenMetadata("T", "T", 0),
            CREATOR, BigInteger.valueOf(1_000), events::addAll);
        ledger.approve(CREATOR, SPENDER, BigInteger.valueOf(30));

        int threads = 8;
        int attemptsPerThread = 10;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger succeeded = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();

        for (int t = 0; t < threads; t++) {
            executor.submit(() -> {
                try {
                    start.await();
                    for (int i = 0; i < attemptsPerThread; i++) {
                        try {
                            ledger.transferFrom(SPENDER, CREATOR, SINK, BigInteger.ONE);
                            succeeded.incrementAndGet();
                        } catch (LedgerException e) {
                            assertEquals(LedgerErrorCode.INSUFFICIENT_ALLOWANCE, e.getErrorCode());
                            rejected.incrementAndGet();
                        }
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }

        start.countDown();
        assertTrue(done.await(30, TimeUnit.SECONDS), "Workers should finish");
        executor.shutdown();

        assertEquals(30, succeeded.get());
        assertEquals(threads * attemptsPerThread - 30, rejected.get());
        assertEquals(BigInteger.valueOf(30), ledger.balanceOf(SINK));
        assertEquals(BigInteger.ZERO, ledger.allowance(CREATOR, SPENDER));
        assertEquals(30, events.stream().filter(TransferEvent.class::isInstance).count());
        assertSupplyInvariant(ledger);

        printSuccess("Allowance spent exactly once");
    }

    private static void assertSupplyInvariant(TokenLedger ledger) {
        BigInteger sum = ledger.balances().values().stream().reduce(BigInteger.ZERO, BigInteger::add);
        assertEquals(ledger.totalSupply(), sum, "Sum of balances must equal total supply");
    }
}
