package com.flagship.token_ledger.outbox;

import lombok.AccessLevel;
import lombok.Value;
import lombok.With;

import java.time.Instant;
import java.util.UUID;

/**
 * Journal entry for a ledger notification.
 *
 * Entries are appended in emission order and never removed. The sequence number is
 * the position in the journal; consumers page through notifications with it.
 * All notifications of one ledger operation share a correlation ID.
 * Publishing state only tracks delivery to Kafka.
 */
@Value
@With(AccessLevel.PRIVATE)
public class OutboxEvent {
    UUID id;                   // notification event ID
    long sequenceNumber;
    String aggregateType;      // "Token"
    String aggregateId;        // token symbol
    String eventType;          // e.g., "Transfer"
    String payload;            // JSON payload
    String correlationId;
    Instant createdAt;
    Instant publishedAt;       // null if not yet published
    int retryCount;
    String lastError;

    public static OutboxEvent create(UUID id, long sequenceNumber, String aggregateType, String aggregateId,
                                     String eventType, String payload, String correlationId) {
        return new OutboxEvent(id, sequenceNumber, aggregateType, aggregateId, eventType, payload,
            correlationId, Instant.now(), null, 0, null);
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    public OutboxEvent markPublished() {
        return withPublishedAt(Instant.now()).withLastError(null);
    }

    public OutboxEvent markRetry(String errorMessage) {
        return withRetryCount(retryCount + 1).withLastError(errorMessage);
    }
}
