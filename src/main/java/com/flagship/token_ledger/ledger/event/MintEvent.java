package com.flagship.token_ledger.ledger.event;

import com.flagship.token_ledger.ledger.Address;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Supply expanded by {@code amount}, credited to {@code receiver}.
 */
@Value
public class MintEvent implements TokenEvent {
    UUID eventId;
    Address receiver;
    BigInteger amount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "Mint";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static MintEvent of(Address receiver, BigInteger amount) {
        return new MintEvent(UUID.randomUUID(), receiver, amount, Instant.now());
    }
}
