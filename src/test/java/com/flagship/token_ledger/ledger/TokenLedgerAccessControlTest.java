package com.flagship.token_ledger.ledger;

import com.flagship.token_ledger.ledger.event.MintAgentChangedEvent;
import com.flagship.token_ledger.ledger.event.TokenEvent;
import com.flagship.token_ledger.ledger.exception.LedgerErrorCode;
import com.flagship.token_ledger.ledger.exception.LedgerException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Ownership and mint agent rules.
 */
class TokenLedgerAccessControlTest {

    private static final Address CREATOR = Address.of("0x00000000000000000000000000000000000000c0");
    private static final Address ALICE = Address.of("0x000000000000000000000000000000000000000a");
    private static final Address BOB = Address.of("0x000000000000000000000000000000000000000b");

    private List<TokenEvent> events;
    private TokenLedger ledger;

    @BeforeEach
    void setUp() {
        events = new ArrayList<>();
        ledger = TokenLedger.create(new TokenMetadata("Flagship Token", "FLAG", 2),
            CREATOR, BigInteger.valueOf(1_000), events::addAll);
    }

    private static void assertRejected(LedgerErrorCode expected, Executable executable) {
        LedgerException exception = assertThrows(LedgerException.class, executable);
        assertEquals(expected, exception.getErrorCode());
    }

    // ==================== transferOwnership ====================

    @Test
    @DisplayName("Owner can hand ownership to another account")
    void testTransferOwnership() {
        ledger.transferOwnership(CREATOR, ALICE);

        assertEquals(ALICE, ledger.owner());
        assertTrue(events.isEmpty(), "Ownership changes emit no notification");
    }

    @Test
    @DisplayName("Ownership transfer does not change mint agent membership")
    void testTransferOwnershipKeepsMintAgents() {
        ledger.transferOwnership(CREATOR, ALICE);

        assertTrue(ledger.isMintAgent(CREATOR));
        assertFalse(ledger.isMintAgent(ALICE));
        assertRejected(LedgerErrorCode.UNAUTHORIZED, () -> ledger.mint(ALICE, BigInteger.ONE));
        ledger.mint(CREATOR, BigInteger.ONE);
    }

    @Test
    @DisplayName("Former owner loses administrative rights")
    void testFormerOwnerIsRejected() {
        ledger.transferOwnership(CREATOR, ALICE);

        assertRejected(LedgerErrorCode.UNAUTHORIZED, () -> ledger.setMintAgent(CREATOR, BOB, true));
        assertRejected(LedgerErrorCode.UNAUTHORIZED, () -> ledger.transferOwnership(CREATOR, BOB));

        ledger.setMintAgent(ALICE, BOB, true);
        assertTrue(ledger.isMintAgent(BOB));
    }

    @Test
    @DisplayName("Non-owner cannot transfer ownership")
    void testTransferOwnershipByNonOwner() {
        assertRejected(LedgerErrorCode.UNAUTHORIZED, () -> ledger.transferOwnership(ALICE, BOB));
        assertEquals(CREATOR, ledger.owner());
    }

    @Test
    @DisplayName("Ownership cannot go to the zero address or to the current owner")
    void testTransferOwnershipInvalidTarget() {
        assertRejected(LedgerErrorCode.INVALID_ARGUMENT, () -> ledger.transferOwnership(CREATOR, Address.ZERO));
        assertRejected(LedgerErrorCode.INVALID_ARGUMENT, () -> ledger.transferOwnership(CREATOR, CREATOR));
        assertEquals(CREATOR, ledger.owner());
    }

    @Test
    @DisplayName("Authorization is checked before the target address")
    void testAuthorizationCheckedFirst() {
        assertRejected(LedgerErrorCode.UNAUTHORIZED, () -> ledger.transferOwnership(ALICE, Address.ZERO));
    }

    // ==================== setMintAgent ====================

    @Test
    @DisplayName("Owner grants mint agent status and the new agent can mint")
    void testGrantMintAgent() {
        ledger.setMintAgent(CREATOR, ALICE, true);
        ledger.mint(ALICE, BigInteger.valueOf(250));

        assertTrue(ledger.isMintAgent(ALICE));
        assertEquals(BigInteger.valueOf(250), ledger.balanceOf(ALICE));

        MintAgentChangedEvent event = assertInstanceOf(MintAgentChangedEvent.class, events.get(0));
        assertEquals(ALICE, event.getAgent());
        assertTrue(event.isEnabled());
    }

    @Test
    @DisplayName("A revoked agent can no longer mint")
    void testRevokedAgentCannotMint() {
        ledger.setMintAgent(CREATOR, ALICE, true);
        ledger.setMintAgent(CREATOR, ALICE, false);

        assertFalse(ledger.isMintAgent(ALICE));
        assertRejected(LedgerErrorCode.UNAUTHORIZED, () -> ledger.mint(ALICE, BigInteger.ONE));
        assertRejected(LedgerErrorCode.UNAUTHORIZED, () -> ledger.burnSelf(ALICE, BigInteger.ONE));
    }

    @Test
    @DisplayName("Setting the same status twice is idempotent but notifies both times")
    void testSetMintAgentIdempotent() {
        ledger.setMintAgent(CREATOR, ALICE, true);
        ledger.setMintAgent(CREATOR, ALICE, true);

        assertTrue(ledger.isMintAgent(ALICE));
        assertEquals(2, events.size());
        assertTrue(events.stream().allMatch(MintAgentChangedEvent.class::isInstance));
    }

    @Test
    @DisplayName("Revoking a non-agent still notifies")
    void testRevokeNonAgentNotifies() {
        ledger.setMintAgent(CREATOR, BOB, false);

        assertFalse(ledger.isMintAgent(BOB));
        MintAgentChangedEvent event = assertInstanceOf(MintAgentChangedEvent.class, events.get(0));
        assertFalse(event.isEnabled());
    }

    @Test
    @DisplayName("Owner can revoke its own mint agent status")
    void testOwnerRevokesSelf() {
        ledger.setMintAgent(CREATOR, CREATOR, false);

        assertFalse(ledger.isMintAgent(CREATOR));
        assertRejected(LedgerErrorCode.UNAUTHORIZED, () -> ledger.mint(CREATOR, BigInteger.ONE));
    }

    @Test
    @DisplayName("Non-owner cannot change mint agents")
    void testSetMintAgentByNonOwner() {
        assertRejected(LedgerErrorCode.UNAUTHORIZED, () -> ledger.setMintAgent(ALICE, ALICE, true));
        assertFalse(ledger.isMintAgent(ALICE));
        assertTrue(events.isEmpty());
    }

    @Test
    @DisplayName("The zero address cannot be made a mint agent")
    void testSetMintAgentZero() {
        assertRejected(LedgerErrorCode.INVALID_ARGUMENT, () -> ledger.setMintAgent(CREATOR, Address.ZERO, true));
    }

    // ==================== Supply permissions ====================

    @Test
    @DisplayName("Non-agent cannot mint")
    void testMintByNonAgent() {
        assertRejected(LedgerErrorCode.UNAUTHORIZED, () -> ledger.mint(ALICE, BigInteger.TEN));
        assertEquals(BigInteger.valueOf(100_000), ledger.totalSupply());
    }

    @Test
    @DisplayName("Non-owner cannot burn from another account, even as a mint agent")
    void testBurnFromByNonOwner() {
        ledger.setMintAgent(CREATOR, ALICE, true);

        assertRejected(LedgerErrorCode.UNAUTHORIZED, () -> ledger.burnFrom(ALICE, CREATOR, BigInteger.ONE));
        assertEquals(BigInteger.valueOf(100_000), ledger.balanceOf(CREATOR));
    }

    @Test
    @DisplayName("Owner that is not a mint agent can still burn from any account")
    void testBurnFromByOwnerWithoutAgentStatus() {
        ledger.transfer(CREATOR, ALICE, BigInteger.valueOf(500));
        ledger.setMintAgent(CREATOR, CREATOR, false);

        ledger.burnFrom(CREATOR, ALICE, BigInteger.valueOf(200));

        assertEquals(BigInteger.valueOf(300), ledger.balanceOf(ALICE));
        assertEquals(BigInteger.valueOf(99_800), ledger.totalSupply());
    }

    @Test
    @DisplayName("The zero address is never an authorized caller")
    void testZeroCaller() {
        assertRejected(LedgerErrorCode.UNAUTHORIZED, () -> ledger.transfer(Address.ZERO, ALICE, BigInteger.ONE));
        assertRejected(LedgerErrorCode.UNAUTHORIZED, () -> ledger.approve(Address.ZERO, ALICE, BigInteger.ONE));
        assertRejected(LedgerErrorCode.UNAUTHORIZED, () -> ledger.mint(Address.ZERO, BigInteger.ONE));
    }
}
