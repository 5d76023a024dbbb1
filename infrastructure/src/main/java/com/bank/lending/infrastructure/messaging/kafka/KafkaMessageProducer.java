package com.bank.lending.infrastructure.messaging.kafka;

import com.bank.lending.domain.messaging.MessageProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Kafka implementation of MessageProducer.
 * A send returns only once the broker has acknowledged the record; any failure is rethrown to the caller.
 */
@Component("kafkaMessageProducer")
public class KafkaMessageProducer implements MessageProducer {

    private static final Logger log = LoggerFactory.getLogger(KafkaMessageProducer.class);

    static final long DEFAULT_SEND_TIMEOUT_MS = 10_000;

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final long sendTimeoutMs;

    public KafkaMessageProducer(KafkaTemplate<String, Object> kafkaTemplate) {
        this(kafkaTemplate, DEFAULT_SEND_TIMEOUT_MS);
    }

    @Autowired
    public KafkaMessageProducer(KafkaTemplate<String, Object> kafkaTemplate,
                                @Value("${app.messaging.send-timeout-ms:10000}") long sendTimeoutMs) {
        this.kafkaTemplate = kafkaTemplate;
        this.sendTimeoutMs = sendTimeoutMs;
    }

    @Override
    public void send(String topic, String key, Object message) {
        send(topic, key, message, null);
    }

    /**
     * Send message, copying the given headers onto the record, and wait for the acknowledgement
     */
    @Override
    public void send(String topic, String key, Object message, Map<String, String> headers) {
        try {
            ProducerRecord<String, Object> record;

            if (key != null) {
                record = new ProducerRecord<>(topic, key, message);
            } else {
                record = new ProducerRecord<>(topic, message);
            }

            if (headers != null) {
                headers.forEach((name, value) -> {
                    if (value != null) {
                        record.headers().add(name, value.getBytes(StandardCharsets.UTF_8));
                    }
                });
            }

            kafkaTemplate.send(record).get(sendTimeoutMs, TimeUnit.MILLISECONDS);
            log.debug("Sent message to topic: {}, key: {}", topic, key);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while sending message to topic: {}", topic, e);
            throw new RuntimeException("Failed to send message to Kafka", e);
        } catch (ExecutionException e) {
            log.error("Broker rejected message for topic: {}", topic, e.getCause());
            throw new RuntimeException("Failed to send message to Kafka", e.getCause());
        } catch (Exception e) {
            log.error("Failed to send message to topic: {}", topic, e);
            throw new RuntimeException("Failed to send message to Kafka", e);
        }
    }
}
