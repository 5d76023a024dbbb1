package com.bank.lending.infrastructure.messaging.kafka;

import com.bank.lending.domain.event.RealtimeEvent;
import com.bank.lending.domain.messaging.MessageProducer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class KafkaRealtimeNotifierTest {

    @Mock
    private MessageProducer messageProducer;

    private final Clock clock = Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC);

    @Test
    void testRealtimeEventKeyedByFirstChannel() {
        // Given
        KafkaRealtimeNotifier notifier = new KafkaRealtimeNotifier(messageProducer, "lending.realtime", clock);

        // When
        notifier.publish("data.correction.submitted", List.of("tenant.1.applicant.10", "tenant.1.admin"), "payload");

        // Then
        ArgumentCaptor<Object> event = ArgumentCaptor.forClass(Object.class);
        verify(messageProducer).send(eq("lending.realtime"), eq("tenant.1.applicant.10"), event.capture(),
                eq(Map.of("event-name", "data.correction.submitted")));
        RealtimeEvent realtime = (RealtimeEvent) event.getValue();
        assertEquals("data.correction.submitted", realtime.getEvent());
        assertEquals("payload", realtime.getData());
    }
}
