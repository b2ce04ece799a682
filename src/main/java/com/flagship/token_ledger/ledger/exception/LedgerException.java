package com.flagship.token_ledger.ledger.exception;

import lombok.Getter;

/**
 * Thrown when a ledger operation is rejected.
 *
 * The error code tells callers (and the HTTP layer) why the operation was aborted.
 * A {@code false} result from {@code transfer} is not an error and never produces this exception.
 */
@Getter
public class LedgerException extends RuntimeException {

    private final LedgerErrorCode errorCode;

    public LedgerException(LedgerErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public static LedgerException unauthorized(String message) {
        return new LedgerException(LedgerErrorCode.UNAUTHORIZED, message);
    }

    public static LedgerException invalidArgument(String message) {
        return new LedgerException(LedgerErrorCode.INVALID_ARGUMENT, message);
    }

    public static LedgerException insufficientBalance(String message) {
        return new LedgerException(LedgerErrorCode.INSUFFICIENT_BALANCE, message);
    }

    public static LedgerException insufficientAllowance(String message) {
        return new LedgerException(LedgerErrorCode.INSUFFICIENT_ALLOWANCE, message);
    }

    public static LedgerException allowanceRaceCondition(String message) {
        return new LedgerException(LedgerErrorCode.ALLOWANCE_RACE_CONDITION, message);
    }

    public static LedgerException overflow(String message) {
        return new LedgerException(LedgerErrorCode.ARITHMETIC_OVERFLOW, message);
    }

    public static LedgerException underflow(String message) {
        return new LedgerException(LedgerErrorCode.ARITHMETIC_UNDERFLOW, message);
    }

    public static LedgerException divisionByZero(String message) {
        return new LedgerException(LedgerErrorCode.DIVISION_BY_ZERO, message);
    }
}
