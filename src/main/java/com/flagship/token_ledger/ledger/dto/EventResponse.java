package com.flagship.token_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonRawValue;
import com.flagship.token_ledger.outbox.OutboxEvent;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One entry of the notification journal as seen by external monitors.
 */
@Value
@Builder
public class EventResponse {

    @JsonProperty("sequence")
    long sequence;

    @JsonProperty("event_id")
    UUID eventId;

    @JsonProperty("event_type")
    String eventType;

    @JsonRawValue
    @JsonProperty("payload")
    String payload;

    @JsonProperty("correlation_id")
    String correlationId;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("published")
    boolean published;

    public static EventResponse from(OutboxEvent event) {
        return EventResponse.builder()
            .sequence(event.getSequenceNumber())
            .eventId(event.getId())
            .eventType(event.getEventType())
            .payload(event.getPayload())
            .correlationId(event.getCorrelationId())
            .createdAt(event.getCreatedAt())
            .published(event.isPublished())
            .build();
    }
}
