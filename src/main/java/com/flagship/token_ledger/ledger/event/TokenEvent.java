package com.flagship.token_ledger.ledger.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for ledger notifications.
 *
 * Notifications are facts about state changes. An operation hands its notifications to
 * the event sink right before committing; they never feed back into ledger state.
 */
public interface TokenEvent {

    /**
     * Unique identifier for this event instance.
     * Used for deduplication in consumers.
     */
    UUID getEventId();

    /**
     * When this event occurred.
     */
    Instant getOccurredAt();

    /**
     * Event type name for routing/filtering.
     */
    String getEventType();
}
