package com.bank.lending.domain.messaging;

import java.util.Map;

/**
 * Abstraction for message producers.
 * Keeps audit and realtime publishing independent of the broker in use.
 */
public interface MessageProducer {

    /**
     * Send a message to a topic/queue
     * @param topic The topic/queue name
     * @param key The message key (for partitioning/ordering)
     * @param message The message payload
     */
    void send(String topic, String key, Object message);

    /**
     * Send a message with extra headers
     * @param topic The topic/queue name
     * @param key The message key (for partitioning/ordering)
     * @param message The message payload
     * @param headers Headers to attach, e.g. correlation id
     */
    default void send(String topic, String key, Object message, Map<String, String> headers) {
        // Default implementation: ignore headers
        send(topic, key, message);
    }

    /**
     * Send a message without a key
     */
    default void send(String topic, Object message) {
        send(topic, null, message);
    }
}
