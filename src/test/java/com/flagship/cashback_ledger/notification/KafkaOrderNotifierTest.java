package com.flagship.cashback_ledger.notification;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.flagship.cashback_ledger.observability.CorrelationContext;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.kafka.core.KafkaTemplate;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class KafkaOrderNotifierTest {

    private KafkaTemplate<String, String> kafkaTemplate;
    private ObjectMapper objectMapper;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        kafkaTemplate = mock(KafkaTemplate.class);
        objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @AfterEach
    void tearDown() {
        CorrelationContext.clear();
    }

    @Test
    @DisplayName("Notifications are keyed by account and carry the correlation id")
    @SuppressWarnings("unchecked")
    void testNotify_PublishesKeyedRecord() throws Exception {
        when(kafkaTemplate.send(any(ProducerRecord.class))).thenReturn(new CompletableFuture<>());
        CorrelationContext.setCorrelationId("corr-123");
        KafkaOrderNotifier notifier = new KafkaOrderNotifier(kafkaTemplate, objectMapper, Runnable::run, "order-notifications");

        notifier.notify("shopper-1", "ORDER_COMPLETED", Map.of("orderId", "o-1"));

        ArgumentCaptor<ProducerRecord<String, String>> captor = ArgumentCaptor.forClass(ProducerRecord.class);
        verify(kafkaTemplate).send(captor.capture());
        ProducerRecord<String, String> record = captor.getValue();
        assertEquals("order-notifications", record.topic());
        assertEquals("shopper-1", record.key());
        assertEquals("corr-123", new String(
                record.headers().lastHeader(CorrelationContext.CORRELATION_ID_HEADER).value(), StandardCharsets.UTF_8));

        Map<?, ?> body = objectMapper.readValue(record.value(), Map.class);
        assertEquals("ORDER_COMPLETED", body.get("event"));
        assertEquals(Map.of("orderId", "o-1"), body.get("payload"));
    }

    @Test
    @DisplayName("Broker and executor failures are dropped")
    @SuppressWarnings("unchecked")
    void testNotify_FailuresDropped() {
        when(kafkaTemplate.send(any(ProducerRecord.class))).thenThrow(new IllegalStateException("broker down"));
        KafkaOrderNotifier direct = new KafkaOrderNotifier(kafkaTemplate, objectMapper, Runnable::run, "t");
        KafkaOrderNotifier saturated = new KafkaOrderNotifier(kafkaTemplate, objectMapper, task -> {
            throw new RejectedExecutionException("queue full");
        }, "t");

        assertDoesNotThrow(() -> direct.notify("shopper-1", "ORDER_REJECTED", Map.of()));
        assertDoesNotThrow(() -> saturated.notify("shopper-1", "ORDER_REJECTED", Map.of()));
        assertDoesNotThrow(() -> direct.notify(null, "ORDER_REJECTED", Map.of()));

        verify(kafkaTemplate, times(1)).send(any(ProducerRecord.class));
    }
}
