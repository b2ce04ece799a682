package com.flagship.token_ledger.arithmetic;

import com.flagship.token_ledger.ledger.exception.LedgerException;

import java.math.BigInteger;

/**
 * Checked arithmetic over token amounts.
 *
 * Amounts are unsigned 256-bit integers: every operand and every result must lie in
 * {@code [0, 2^256 - 1]}. Results outside that range fail instead of wrapping.
 */
public final class SafeMath {

    public static final BigInteger MAX_AMOUNT = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    private SafeMath() {
        // Utility class
    }

    /**
     * @throws LedgerException ARITHMETIC_OVERFLOW if the sum exceeds {@link #MAX_AMOUNT}
     */
    public static BigInteger add(BigInteger a, BigInteger b) {
        requireAmount(a, "a");
        requireAmount(b, "b");
        BigInteger result = a.add(b);
        if (result.compareTo(MAX_AMOUNT) > 0) {
            throw LedgerException.overflow(String.format("Addition overflows: %s + %s", a, b));
        }
        return result;
    }

    /**
     * @throws LedgerException ARITHMETIC_UNDERFLOW if {@code b > a}
     */
    public static BigInteger sub(BigInteger a, BigInteger b) {
        requireAmount(a, "a");
        requireAmount(b, "b");
        if (b.compareTo(a) > 0) {
            throw LedgerException.underflow(String.format("Subtraction underflows: %s - %s", a, b));
        }
        return a.subtract(b);
    }

    /**
     * @throws LedgerException ARITHMETIC_OVERFLOW if the product exceeds {@link #MAX_AMOUNT}
     */
    public static BigInteger mul(BigInteger a, BigInteger b) {
        requireAmount(a, "a");
        requireAmount(b, "b");
        BigInteger result = a.multiply(b);
        if (result.compareTo(MAX_AMOUNT) > 0) {
            throw LedgerException.overflow(String.format("Multiplication overflows: %s * %s", a, b));
        }
        return result;
    }

    /**
     * Truncating division.
     *
     * @throws LedgerException DIVISION_BY_ZERO if {@code b == 0}
     */
    public static BigInteger div(BigInteger a, BigInteger b) {
        requireAmount(a, "a");
        requireAmount(b, "b");
        if (b.signum() == 0) {
            throw LedgerException.divisionByZero("Division by zero: " + a + " / 0");
        }
        return a.divide(b);
    }

    /**
     * Computes {@code 10^exponent} with overflow checking on every step.
     */
    public static BigInteger pow10(int exponent) {
        if (exponent < 0) {
            throw LedgerException.invalidArgument("Exponent must not be negative: " + exponent);
        }
        BigInteger result = BigInteger.ONE;
        for (int i = 0; i < exponent; i++) {
            result = mul(result, BigInteger.TEN);
        }
        return result;
    }

    public static boolean isAmount(BigInteger value) {
        return value != null && value.signum() >= 0 && value.compareTo(MAX_AMOUNT) <= 0;
    }

    /**
     * Rejects null, negative or out-of-range values.
     */
    public static BigInteger requireAmount(BigInteger value, String name) {
        if (!isAmount(value)) {
            throw LedgerException.invalidArgument(
                String.format("%s must be an unsigned 256-bit amount, got %s", name, value));
        }
        return value;
    }
}
