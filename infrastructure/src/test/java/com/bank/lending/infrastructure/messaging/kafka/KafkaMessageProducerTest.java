package com.bank.lending.infrastructure.messaging.kafka;

import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * KafkaMessageProducer record keys and headers
 */
@ExtendWith(MockitoExtension.class)
class KafkaMessageProducerTest {

    @Mock
    private KafkaTemplate<String, Object> kafkaTemplate;

    private KafkaMessageProducer producer;

    @BeforeEach
    void setUp() {
        producer = new KafkaMessageProducer(kafkaTemplate);
    }

    @Test
    void testSendMessageWithKey_SetsPartitionKey() {
        // Given
        givenAcknowledged();
        String topic = "lending.audit";
        String key = "10";
        String message = "{\"action\":\"DATA_CORRECTED\"}";

        // When
        producer.send(topic, key, message);

        // Then
        ProducerRecord<String, Object> record = captureRecord();
        assertEquals(topic, record.topic());
        assertEquals(key, record.key());
        assertEquals(message, record.value());
    }

    @Test
    void testSendMessageWithoutKey_NoPartitionKey() {
        givenAcknowledged();
        producer.send("lending.realtime", null, "payload");

        ProducerRecord<String, Object> record = captureRecord();
        assertNull(record.key());
        assertEquals("payload", record.value());
    }

    @Test
    void testHeadersAreCopiedAndNullValuesSkipped() {
        // Given
        givenAcknowledged();
        Map<String, String> headers = new HashMap<>();
        headers.put("audit-action", "DATA_CORRECTED");
        headers.put("correlation-id", null);

        // When
        producer.send("lending.audit", "10", "payload", headers);

        // Then
        ProducerRecord<String, Object> record = captureRecord();
        assertEquals("DATA_CORRECTED",
                new String(record.headers().lastHeader("audit-action").value(), StandardCharsets.UTF_8));
        assertNull(record.headers().lastHeader("correlation-id"));
    }

    @Test
    void testSendFailureIsWrapped() {
        // Given
        when(kafkaTemplate.send(any(ProducerRecord.class))).thenThrow(new IllegalStateException("producer closed"));

        // When
        RuntimeException ex = assertThrows(RuntimeException.class, () -> producer.send("lending.audit", "10", "payload"));

        // Then
        assertEquals("Failed to send message to Kafka", ex.getMessage());
        assertInstanceOf(IllegalStateException.class, ex.getCause());
    }

    @Test
    void testBrokerFailureReachesTheCaller() {
        // Given
        when(kafkaTemplate.send(any(ProducerRecord.class)))
                .thenReturn(CompletableFuture.failedFuture(new KafkaException("broker down")));

        // When
        RuntimeException ex = assertThrows(RuntimeException.class, () -> producer.send("lending.audit", "10", "audit"));

        // Then
        assertEquals("Failed to send message to Kafka", ex.getMessage());
        assertInstanceOf(KafkaException.class, ex.getCause());
        assertEquals("broker down", ex.getCause().getMessage());
    }

    @Test
    void testUnacknowledgedSendTimesOut() {
        // Given
        KafkaMessageProducer impatient = new KafkaMessageProducer(kafkaTemplate, 50);
        when(kafkaTemplate.send(any(ProducerRecord.class))).thenReturn(new CompletableFuture<SendResult<String, Object>>());

        // When
        RuntimeException ex = assertThrows(RuntimeException.class, () -> impatient.send("lending.audit", "10", "audit"));

        // Then
        assertInstanceOf(TimeoutException.class, ex.getCause());
    }

    private void givenAcknowledged() {
        when(kafkaTemplate.send(any(ProducerRecord.class)))
                .thenReturn(CompletableFuture.completedFuture(null));
    }

    @SuppressWarnings("unchecked")
    private ProducerRecord<String, Object> captureRecord() {
        ArgumentCaptor<ProducerRecord<String, Object>> recordCaptor = ArgumentCaptor.forClass(ProducerRecord.class);
        verify(kafkaTemplate).send(recordCaptor.capture());
        return recordCaptor.getValue();
    }
}
