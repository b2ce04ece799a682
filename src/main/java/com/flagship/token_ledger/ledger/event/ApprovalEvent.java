package com.flagship.token_ledger.ledger.event;

import com.flagship.token_ledger.ledger.Address;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * The allowance of {@code spender} over {@code owner}'s balance now equals {@code value}.
 */
@Value
public class ApprovalEvent implements TokenEvent {
    UUID eventId;
    Address owner;
    Address spender;
    BigInteger value;
    Instant occurredAt;

    public static final String EVENT_TYPE = "Approval";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static ApprovalEvent of(Address owner, Address spender, BigInteger value) {
        return new ApprovalEvent(UUID.randomUUID(), owner, spender, value, Instant.now());
    }
}
