package com.flagship.token_ledger.ledger.event;

import com.flagship.token_ledger.ledger.Address;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Supply contracted by {@code amount}, debited from {@code burner}.
 */
@Value
public class BurnEvent implements TokenEvent {
    UUID eventId;
    Address burner;
    BigInteger amount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "Burn";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static BurnEvent of(Address burner, BigInteger amount) {
        return new BurnEvent(UUID.randomUUID(), burner, amount, Instant.now());
    }
}
