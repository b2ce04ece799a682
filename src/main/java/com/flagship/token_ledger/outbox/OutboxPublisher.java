package com.flagship.token_ledger.outbox;

import com.flagship.token_ledger.observability.CorrelationContext;
import com.flagship.token_ledger.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ExecutionException;

/**
 * Background publisher that reads ledger notifications from the outbox and publishes them to Kafka.
 *
 * This component:
 * 1. Polls the outbox for unpublished events, oldest first
 * 2. Publishes each event keyed by token symbol, with its correlation ID as a record header
 * 3. Marks events as published once the broker acknowledges them
 * 4. Stops the batch at the first failure, so a later event never overtakes an earlier one
 *
 * An event that fails {@code max-retries} times becomes a dead letter: it stays in the
 * journal, is no longer sent, and no longer holds back the events behind it.
 * Publishing never touches ledger state; a broker outage only grows the backlog.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.token-events:token-events}")
    private String tokenEventsTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        List<OutboxEvent> events;
        try {
            events = outboxService.findUnpublishedEvents(batchSize, maxRetries);
        } catch (RuntimeException e) {
            log.error("Error in outbox publisher polling loop", e);
            return;
        }

        if (events.isEmpty()) {
            return;
        }
        log.debug("Found {} unpublished events to process", events.size());

        for (OutboxEvent event : events) {
            if (!publishEvent(event)) {
                break;
            }
        }
    }

    /**
     * Publishes a single event and waits for the broker acknowledgment.
     *
     * @return false if the batch must stop here
     */
    private boolean publishEvent(OutboxEvent event) {
        MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, event.getCorrelationId());
        try {
            ProducerRecord<String, String> record =
                new ProducerRecord<>(tokenEventsTopic, event.getAggregateId(), event.getPayload());
            record.headers().add(CorrelationContext.CORRELATION_ID_HEADER,
                event.getCorrelationId().getBytes(StandardCharsets.UTF_8));

            SendResult<String, String> result = kafkaTemplate.send(record).get();

            log.debug("Published event: eventId={}, sequence={}, partition={}, offset={}, eventType={}",
                event.getId(),
                event.getSequenceNumber(),
                result.getRecordMetadata().partition(),
                result.getRecordMetadata().offset(),
                event.getEventType());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());
            return true;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Publisher interrupted at event {}; stopping this batch", event.getId());
            return false;
        } catch (ExecutionException | RuntimeException e) {
            String error = e instanceof ExecutionException && e.getCause() != null
                ? e.getCause().getMessage()
                : e.getMessage();
            log.error("Failed to publish event: eventId={}, sequence={}, eventType={}, error={}",
                event.getId(), event.getSequenceNumber(), event.getEventType(), error);
            recordFailure(event, error);
            return false;
        } finally {
            MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
        }
    }

    private void recordFailure(OutboxEvent event, String errorMessage) {
        outboxMetrics.recordEventPublishFailed(event.getEventType());
        outboxService.markFailed(event.getId(), errorMessage)
            .filter(failed -> failed.getRetryCount() >= maxRetries)
            .ifPresent(failed -> {
                log.warn("Event {} has exceeded max retries ({}), moving to dead letter. eventType={}, sequence={}",
                    failed.getId(), maxRetries, failed.getEventType(), failed.getSequenceNumber());
                outboxMetrics.recordEventDeadLettered(failed.getEventType());
            });
    }

    /**
     * Runs one polling cycle immediately.
     */
    public void triggerPublish() {
        publishPendingEvents();
    }
}
