package com.flagship.exchange_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic for the real-time settlement broadcast.
 *
 * Only active while the Kafka notifier is enabled, so that environments
 * without a broker do not block on topic creation at startup.
 */
@Configuration
@ConditionalOnProperty(name = "exchange.broadcast.kafka.enabled", havingValue = "true", matchIfMissing = true)
public class KafkaConfig {

    @Value("${kafka.topic.settlements:exchange-settlements}")
    private String settlementsTopic;

    /**
     * Keyed by drawer id, so one drawer's broadcasts stay ordered within a partition.
     */
    @Bean
    public NewTopic settlementsTopic() {
        return TopicBuilder.name(settlementsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
