package com.flagship.token_ledger.ledger.event;

import com.flagship.token_ledger.ledger.Address;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Tokens moved from one account to another.
 *
 * Mints are reported with {@code from = Address.ZERO}, burns with {@code to = Address.ZERO}.
 */
@Value
public class TransferEvent implements TokenEvent {
    UUID eventId;
    Address from;
    Address to;
    BigInteger value;
    Instant occurredAt;

    public static final String EVENT_TYPE = "Transfer";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static TransferEvent of(Address from, Address to, BigInteger value) {
        return new TransferEvent(UUID.randomUUID(), from, to, value, Instant.now());
    }
}
