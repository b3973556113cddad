package com.flagship.cashback_ledger.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.cashback_ledger.observability.CorrelationContext;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Publishes order notifications to Kafka from a background executor.
 * Failures are logged and dropped.
 */
@Component
@Slf4j
public class KafkaOrderNotifier implements OrderNotifier {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final Executor executor;
    private final String topic;

    public KafkaOrderNotifier(KafkaTemplate<String, String> kafkaTemplate,
                              ObjectMapper objectMapper,
                              @Qualifier("notificationExecutor") Executor executor,
                              @Value("${kafka.topic.notifications:order-notifications}") String topic) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.executor = executor;
        this.topic = topic;
    }

    @Override
    public void notify(String accountId, String event, Map<String, Object> payload) {
        if (accountId == null) {
            return;
        }
        try {
            executor.execute(() -> send(accountId, event, payload));
        } catch (Exception e) {
            log.warn("Notification {} for account {} dropped: {}", event, accountId, e.getMessage());
        }
    }

    private void send(String accountId, String event, Map<String, Object> payload) {
        String body;
        try {
            Map<String, Object> message = new LinkedHashMap<>();
            message.put("accountId", accountId);
            message.put("event", event);
            message.put("payload", payload);
            message.put("occurredAt", Instant.now());
            body = objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize notification {} for account {}: {}", event, accountId, e.getMessage());
            return;
        }

        ProducerRecord<String, String> record = new ProducerRecord<>(topic, accountId, body);
        record.headers().add(CorrelationContext.CORRELATION_ID_HEADER,
                CorrelationContext.getCorrelationId().getBytes(StandardCharsets.UTF_8));

        try {
            kafkaTemplate.send(record).whenComplete((result, error) -> {
                if (error != null) {
                    log.warn("Failed to publish notification {} for account {}: {}", event, accountId, error.getMessage());
                } else {
                    log.debug("Published notification {} for account {} to partition {} offset {}",
                            event, accountId,
                            result.getRecordMetadata().partition(),
                            result.getRecordMetadata().offset());
                }
            });
        } catch (Exception e) {
            log.warn("Failed to publish notification {} for account {}: {}", event, accountId, e.getMessage());
        }
    }
}
