package com.bank.lending.infrastructure.messaging.kafka;

import com.bank.lending.domain.event.RealtimeEvent;
import com.bank.lending.domain.messaging.MessageProducer;
import com.bank.lending.domain.notification.RealtimeNotifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

/**
 * Publishes realtime events to the broadcast topic; a websocket gateway fans them out per channel
 */
@Component
public class KafkaRealtimeNotifier implements RealtimeNotifier {

    private static final Logger log = LoggerFactory.getLogger(KafkaRealtimeNotifier.class);

    private final MessageProducer messageProducer;
    private final String realtimeTopic;
    private final Clock clock;

    public KafkaRealtimeNotifier(@Qualifier("kafkaMessageProducer") MessageProducer messageProducer,
                                 @Value("${app.messaging.topics.realtime:lending.realtime}") String realtimeTopic,
                                 Clock clock) {
        this.messageProducer = messageProducer;
        this.realtimeTopic = realtimeTopic;
        this.clock = clock;
    }

    @Override
    public void publish(String eventName, List<String> channels, Object payload) {
        RealtimeEvent event = RealtimeEvent.builder()
                .event(eventName)
                .channels(channels)
                .publishedAt(OffsetDateTime.now(clock))
                .data(payload)
                .build();
        String key = channels != null && !channels.isEmpty() ? channels.get(0) : null;
        messageProducer.send(realtimeTopic, key, event, Map.of("event-name", eventName));
        log.debug("Realtime event {} published to {}", eventName, channels);
    }
}
