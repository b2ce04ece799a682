package com.flagship.token_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka configuration for ledger notifications.
 *
 * Only active with the outbox publisher, so the service starts without a broker.
 */
@Configuration
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true")
public class KafkaConfig {

    @Value("${kafka.topic.token-events:token-events}")
    private String tokenEventsTopic;

    /**
     * Creates the notifications topic if it doesn't exist.
     * One partition: consumers must see notifications in ledger order.
     */
    @Bean
    public NewTopic tokenEventsTopic() {
        return TopicBuilder.name(tokenEventsTopic)
                .partitions(1)
                .replicas(1)
                .build();
    }
}
