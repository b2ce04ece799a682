package com.flagship.token_ledger.observability;

import com.flagship.token_ledger.outbox.OutboxService;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for the notification outbox.
 *
 * - Backlog size: how many notifications are waiting to be published
 * - Oldest event age: how long the oldest waiting notification has been queued
 * - Dead letters: notifications that exceeded the retry limit
 *
 * Gauges read cached values; {@link MetricsScheduler} refreshes them.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxMetrics {

    private final OutboxService outboxService;
    private final MeterRegistry meterRegistry;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    private final AtomicLong backlogSize = new AtomicLong(0);
    private final AtomicLong oldestEventAgeSeconds = new AtomicLong(0);
    private final AtomicLong deadLetterCount = new AtomicLong(0);

    @PostConstruct
    public void init() {
        Gauge.builder("outbox.backlog.size", backlogSize, AtomicLong::get)
                .description("Number of unpublished events in the outbox")
                .tag("status", "pending")
                .register(meterRegistry);

        Gauge.builder("outbox.backlog.age.seconds", oldestEventAgeSeconds, AtomicLong::get)
                .description("Age of the oldest unpublished event in seconds")
                .register(meterRegistry);

        Gauge.builder("outbox.events.dead_letters", deadLetterCount, AtomicLong::get)
                .description("Number of events that exceeded max retry attempts and are no longer sent")
                .register(meterRegistry);

        log.info("Outbox metrics registered with Micrometer");
    }

    public void refreshMetrics() {
        long unpublished = outboxService.countUnpublished();
        backlogSize.set(unpublished);

        outboxService.findOldestUnpublishedCreatedAt()
                .ifPresentOrElse(
                        oldest -> {
                            long ageSeconds = Duration.between(oldest, Instant.now()).getSeconds();
                            oldestEventAgeSeconds.set(Math.max(0, ageSeconds));
                        },
                        () -> oldestEventAgeSeconds.set(0)
                );

        long failed = outboxService.countDeadLetters(maxRetries);
        deadLetterCount.set(failed);

        log.debug("Outbox metrics refreshed: backlog={}, oldestAge={}s, deadLetters={}",
                unpublished, oldestEventAgeSeconds.get(), failed);
    }

    public void recordEventPublished(String eventType) {
        meterRegistry.counter("outbox.events.published",
                "event_type", eventType,
                "status", "success"
        ).increment();
    }

    public void recordEventPublishFailed(String eventType) {
        meterRegistry.counter("outbox.events.published",
                "event_type", eventType,
                "status", "failure"
        ).increment();
    }

    public void recordEventDeadLettered(String eventType) {
        meterRegistry.counter("outbox.events.dead_lettered",
                "event_type", eventType
        ).increment();
    }
}
