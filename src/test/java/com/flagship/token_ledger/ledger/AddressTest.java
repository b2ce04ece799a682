package com.flagship.token_ledger.ledger;

import com.flagship.token_ledger.ledger.exception.LedgerErrorCode;
import com.flagship.token_ledger.ledger.exception.LedgerException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AddressTest {

    @Test
    @DisplayName("Addresses are normalized to lower case and compare by value")
    void testNormalization() {
        Address upper = Address.of("0xABCDEF0123456789ABCDEF0123456789ABCDEF01");
        Address lower = Address.of("0xabcdef0123456789abcdef0123456789abcdef01");

        assertEquals(lower, upper);
        assertEquals(lower.hashCode(), upper.hashCode());
        assertEquals("0xabcdef0123456789abcdef0123456789abcdef01", upper.getValue());
    }

    @Test
    @DisplayName("The zero address is recognized")
    void testZero() {
        assertTrue(Address.ZERO.isZero());
        assertTrue(Address.of("0x0000000000000000000000000000000000000000").isZero());
        assertFalse(Address.of("0x0000000000000000000000000000000000000001").isZero());
    }

    @Test
    @DisplayName("Malformed addresses are rejected")
    void testMalformed() {
        for (String text : new String[] {null, "", "0x1234", "1234567890123456789012345678901234567890",
                "0xzz34567890123456789012345678901234567890"}) {
            LedgerException exception = assertThrows(LedgerException.class, () -> Address.of(text));
            assertEquals(LedgerErrorCode.INVALID_ARGUMENT, exception.getErrorCode());
        }
    }
}
