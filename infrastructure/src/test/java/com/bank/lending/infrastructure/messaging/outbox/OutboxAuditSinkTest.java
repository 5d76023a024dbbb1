package com.bank.lending.infrastructure.messaging.outbox;

import com.bank.lending.domain.enums.AuditAction;
import com.bank.lending.domain.event.AuditEvent;
import com.bank.lending.infrastructure.persistence.entity.AuditOutboxEntity;
import com.bank.lending.infrastructure.persistence.repository.AuditOutboxRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OutboxAuditSinkTest {

    @Mock
    private AuditOutboxRepository outboxRepository;

    private final Clock clock = Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC);

    private OutboxAuditSink auditSink;

    @BeforeEach
    void setUp() {
        auditSink = new OutboxAuditSink(outboxRepository, clock);
    }

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    void testAuditRecordIsStagedNotSent() {
        // Given
        MDC.put("correlationId", "corr-1");
        givenSaved();

        // When
        auditSink.emit(AuditAction.DATA_CORRECTED, 1L, Map.of("applicant_id", 10L, "entity_type", "DataVerification"));

        // Then
        ArgumentCaptor<AuditOutboxEntity> staged = ArgumentCaptor.forClass(AuditOutboxEntity.class);
        verify(outboxRepository).save(staged.capture());
        AuditOutboxEntity record = staged.getValue();
        assertEquals("DATA_CORRECTED", record.getAction());
        assertEquals("10", record.getMessageKey());
        assertEquals("corr-1", record.getCorrelationId());
        assertEquals(OffsetDateTime.parse("2024-03-01T10:00:00Z"), record.getCreatedAt());
        assertFalse(record.isPublished());
        assertEquals(0, record.getAttempts());

        AuditEvent event = record.getEvent();
        assertEquals("DATA_CORRECTED", event.getAction());
        assertEquals(1L, event.getTenantId());
        assertEquals("corr-1", event.getCorrelationId());
        assertEquals("DataVerification", event.getPayload().get("entity_type"));
    }

    @Test
    void testAuditWithoutApplicantHasNoKey() {
        givenSaved();

        auditSink.emit(AuditAction.APPLICATION_STATUS_CHANGED, 1L, null);

        ArgumentCaptor<AuditOutboxEntity> staged = ArgumentCaptor.forClass(AuditOutboxEntity.class);
        verify(outboxRepository).save(staged.capture());
        assertNull(staged.getValue().getMessageKey());
        assertTrue(staged.getValue().getEvent().getPayload().isEmpty());
    }

    @Test
    void testStagingFailurePropagates() {
        when(outboxRepository.save(any(AuditOutboxEntity.class))).thenThrow(new IllegalStateException("connection closed"));

        assertThrows(IllegalStateException.class,
                () -> auditSink.emit(AuditAction.DATA_CORRECTED, 1L, Map.of("applicant_id", 10L)));
    }

    private void givenSaved() {
        when(outboxRepository.save(any(AuditOutboxEntity.class))).thenAnswer(inv -> inv.getArgument(0));
    }
}
