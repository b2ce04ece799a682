package com.flagship.token_ledger.ledger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.flagship.token_ledger.ledger.exception.LedgerException;
import lombok.Value;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Identity of a token holder or actor: 20 bytes, written as {@code 0x} followed by 40 hex digits.
 *
 * Addresses are normalized to lower case so that equality and map lookups do not depend
 * on how the caller spelled them. {@link #ZERO} is the null identifier: it never holds a
 * balance and is only used as the counterparty of mint and burn notifications.
 */
@Value
public class Address {

    public static final String PATTERN = "^0[xX][0-9a-fA-F]{40}$";

    private static final Pattern FORMAT = Pattern.compile(PATTERN);

    public static final Address ZERO = new Address("0x" + "0".repeat(40));

    @JsonValue
    String value;

    private Address(String value) {
        this.value = value;
    }

    /**
     * Parses an address.
     *
     * @throws LedgerException INVALID_ARGUMENT if the text is not a 20-byte hex address
     */
    @JsonCreator
    public static Address of(String text) {
        if (text == null || !FORMAT.matcher(text.trim()).matches()) {
            throw LedgerException.invalidArgument("Invalid address: " + text);
        }
        return new Address("0x" + text.trim().substring(2).toLowerCase(Locale.ROOT));
    }

    public boolean isZero() {
        return ZERO.equals(this);
    }

    @Override
    public String toString() {
        return value;
    }
}
