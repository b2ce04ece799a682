package com.flagship.token_ledger.ledger.exception;

/**
 * Reasons a ledger operation can be aborted.
 *
 * Every code aborts the whole operation; none of them leave partial state behind.
 */
public enum LedgerErrorCode {
    UNAUTHORIZED,
    INVALID_ARGUMENT,
    INSUFFICIENT_BALANCE,
    INSUFFICIENT_ALLOWANCE,
    ALLOWANCE_RACE_CONDITION,
    ARITHMETIC_OVERFLOW,
    ARITHMETIC_UNDERFLOW,
    DIVISION_BY_ZERO
}
