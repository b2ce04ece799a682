package com.flagship.token_ledger.ledger.event;

import com.flagship.token_ledger.ledger.Address;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Mint agent membership of {@code agent} was set to {@code enabled}.
 *
 * Emitted on every call, including calls that did not change membership.
 */
@Value
public class MintAgentChangedEvent implements TokenEvent {
    UUID eventId;
    Address agent;
    boolean enabled;
    Instant occurredAt;

    public static final String EVENT_TYPE = "MintAgentChanged";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static MintAgentChangedEvent of(Address agent, boolean enabled) {
        return new MintAgentChangedEvent(UUID.randomUUID(), agent, enabled, Instant.now());
    }
}
