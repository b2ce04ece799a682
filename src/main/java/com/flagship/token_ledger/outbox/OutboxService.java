package com.flagship.token_ledger.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.token_ledger.ledger.TokenEventSink;
import com.flagship.token_ledger.ledger.event.TokenEvent;
import com.flagship.token_ledger.observability.CorrelationContext;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Append-only journal of ledger notifications.
 *
 * The ledger appends each operation's events here before applying its writes. A batch is
 * serialized completely before anything is appended, so a serialization failure aborts
 * the operation without leaving half of its notifications behind.
 *
 * The journal is the history consumers page through, so entries are kept after
 * publishing. Publisher bookkeeping only touches the unpublished tail: every entry
 * before {@code firstUnpublished} has been delivered, and lookups by event ID go
 * through an index instead of scanning.
 *
 * Events are NOT published directly to Kafka here. That's done by the
 * OutboxPublisher, which runs as a background process.
 */
@Slf4j
public class OutboxService implements TokenEventSink {

    public static final String AGGREGATE_TYPE = "Token";

    private final ObjectMapper objectMapper;
    private final String aggregateId;

    // Guarded by "this"
    private final List<OutboxEvent> journal = new ArrayList<>();
    private final Map<UUID, Integer> positions = new HashMap<>();
    private int firstUnpublished;
    private long unpublishedCount;

    public OutboxService(ObjectMapper objectMapper, String aggregateId) {
        this.objectMapper = objectMapper;
        this.aggregateId = aggregateId;
    }

    /**
     * Appends one operation's notifications under a shared correlation ID: the ID of
     * the request being served, or a fresh one outside a request.
     */
    @Override
    public void append(List<TokenEvent> events) {
        List<String> payloads = new ArrayList<>(events.size());
        for (TokenEvent event : events) {
            payloads.add(serializePayload(event));
        }
        String correlationId = CorrelationContext.currentOrGenerate();

        synchronized (this) {
            for (int i = 0; i < events.size(); i++) {
                TokenEvent event = events.get(i);
                long sequenceNumber = journal.size() + 1L;
                positions.put(event.getEventId(), journal.size());
                journal.add(OutboxEvent.create(event.getEventId(), sequenceNumber, AGGREGATE_TYPE, aggregateId,
                    event.getEventType(), payloads.get(i), correlationId));
                unpublishedCount++;
                log.debug("Saved outbox event: type={}, sequence={}, correlationId={}",
                    event.getEventType(), sequenceNumber, correlationId);
            }
        }
    }

    /**
     * Returns up to {@code limit} events with a sequence number greater than {@code afterSequence}.
     */
    public synchronized List<OutboxEvent> findEventsAfter(long afterSequence, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("Limit must be positive");
        }
        int from = (int) Math.min(Math.max(afterSequence, 0L), journal.size());
        int to = Math.min(from + limit, journal.size());
        return List.copyOf(journal.subList(from, to));
    }

    /**
     * Finds unpublished events for the publisher to process, oldest first.
     * Events that already failed {@code maxRetries} times are dead letters and are skipped.
     */
    public synchronized List<OutboxEvent> findUnpublishedEvents(int limit, int maxRetries) {
        List<OutboxEvent> pending = new ArrayList<>(Math.min(limit, journal.size() - firstUnpublished));
        for (int i = firstUnpublished; i < journal.size() && pending.size() < limit; i++) {
            OutboxEvent event = journal.get(i);
            if (!event.isPublished() && event.getRetryCount() < maxRetries) {
                pending.add(event);
            }
        }
        return pending;
    }

    public void markPublished(UUID eventId) {
        Optional<OutboxEvent> published;
        synchronized (this) {
            published = replace(eventId, event -> event.isPublished() ? event : event.markPublished(), true);
            while (firstUnpublished < journal.size() && journal.get(firstUnpublished).isPublished()) {
                firstUnpublished++;
            }
        }
        published.ifPresent(event -> log.debug("Marked event {} as published", eventId));
    }

    /**
     * Records a failed publish attempt.
     *
     * @return the updated event, empty if no event has that ID
     */
    public Optional<OutboxEvent> markFailed(UUID eventId, String errorMessage) {
        Optional<OutboxEvent> updated;
        synchronized (this) {
            updated = replace(eventId, event -> event.markRetry(errorMessage), false);
        }
        updated.ifPresent(event -> log.warn("Marked event {} as failed (retry #{}): {}",
            eventId, event.getRetryCount(), errorMessage));
        return updated;
    }

    public synchronized long countUnpublished() {
        return unpublishedCount;
    }

    public synchronized long countDeadLetters(int maxRetries) {
        long deadLetters = 0;
        for (int i = firstUnpublished; i < journal.size(); i++) {
            OutboxEvent event = journal.get(i);
            if (!event.isPublished() && event.getRetryCount() >= maxRetries) {
                deadLetters++;
            }
        }
        return deadLetters;
    }

    public synchronized Optional<Instant> findOldestUnpublishedCreatedAt() {
        return firstUnpublished < journal.size()
            ? Optional.of(journal.get(firstUnpublished).getCreatedAt())
            : Optional.empty();
    }

    public synchronized long size() {
        return journal.size();
    }

    private Optional<OutboxEvent> replace(UUID eventId, UnaryOperator<OutboxEvent> update, boolean publishing) {
        Integer position = positions.get(eventId);
        if (position == null) {
            return Optional.empty();
        }
        OutboxEvent current = journal.get(position);
        OutboxEvent updated = update.apply(current);
        if (publishing && !current.isPublished()) {
            unpublishedCount--;
        }
        journal.set(position, updated);
        return Optional.of(updated);
    }

    private String serializePayload(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event payload", e);
        }
    }
}
