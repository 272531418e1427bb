package com.flagship.exchange_ledger.settlement.broadcast;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.exchange_ledger.observability.CorrelationContext;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Publishes settlement broadcasts to Kafka, keyed by drawer id.
 *
 * Sends are asynchronous; the outcome is only logged.
 */
@Component
@ConditionalOnProperty(name = "exchange.broadcast.kafka.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class KafkaSettlementNotifier implements SettlementNotifier {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final String settlementsTopic;

    public KafkaSettlementNotifier(KafkaTemplate<String, String> kafkaTemplate,
                                   ObjectMapper objectMapper,
                                   @Value("${kafka.topic.settlements:exchange-settlements}") String settlementsTopic) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.settlementsTopic = settlementsTopic;
    }

    @Override
    public void publish(SettlementBroadcast broadcast) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(broadcast);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize settlement broadcast " + broadcast.getTransactionId(), e);
        }

        ProducerRecord<String, String> record =
            new ProducerRecord<>(settlementsTopic, broadcast.getDrawerId().toString(), payload);
        if (broadcast.getCorrelationId() != null) {
            record.headers().add(CorrelationContext.CORRELATION_ID_HEADER,
                broadcast.getCorrelationId().getBytes(StandardCharsets.UTF_8));
        }

        kafkaTemplate.send(record).whenComplete((result, ex) -> {
            if (ex != null) {
                log.warn("Settlement broadcast failed: transactionId={}, error={}",
                        broadcast.getTransactionId(), ex.getMessage());
            } else {
                log.debug("Settlement broadcast sent: transactionId={}, partition={}, offset={}",
                        broadcast.getTransactionId(),
                        result.getRecordMetadata().partition(),
                        result.getRecordMetadata().offset());
            }
        });
    }
}
