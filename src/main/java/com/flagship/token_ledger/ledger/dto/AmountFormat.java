package com.flagship.token_ledger.ledger.dto;

/**
 * Amounts travel as unsigned decimal strings of at most 78 digits (the width of 2^256 - 1).
 * The range itself is checked by the ledger.
 */
final class AmountFormat {

    static final String PATTERN = "^[0-9]{1,78}$";
    static final String MESSAGE = "Amount must be an unsigned decimal integer";

    private AmountFormat() {
    }
}
