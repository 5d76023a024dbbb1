package com.bank.lending.infrastructure.messaging.outbox;

import com.bank.lending.domain.audit.AuditSink;
import com.bank.lending.domain.enums.AuditAction;
import com.bank.lending.domain.event.AuditEvent;
import com.bank.lending.infrastructure.persistence.entity.AuditOutboxEntity;
import com.bank.lending.infrastructure.persistence.repository.AuditOutboxRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stages audit records in the audit outbox table of the caller's transaction.
 * The record is published by {@link AuditOutboxDispatcher} only once that transaction has committed,
 * and disappears with it on rollback.
 */
@Component
public class OutboxAuditSink implements AuditSink {

    private static final Logger log = LoggerFactory.getLogger(OutboxAuditSink.class);

    static final String CORRELATION_ID_KEY = "correlationId";

    private final AuditOutboxRepository outboxRepository;
    private final Clock clock;

    public OutboxAuditSink(AuditOutboxRepository outboxRepository, Clock clock) {
        this.outboxRepository = outboxRepository;
        this.clock = clock;
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void emit(AuditAction action, Long tenantId, Map<String, Object> payload) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        String correlationId = MDC.get(CORRELATION_ID_KEY);
        AuditEvent event = AuditEvent.builder()
                .action(action.name())
                .tenantId(tenantId)
                .correlationId(correlationId)
                .occurredAt(now)
                .payload(payload != null ? new LinkedHashMap<>(payload) : Map.of())
                .build();

        Object applicantId = payload != null ? payload.get("applicant_id") : null;

        AuditOutboxEntity staged = outboxRepository.save(AuditOutboxEntity.builder()
                .action(action.name())
                .tenantId(tenantId)
                .messageKey(applicantId != null ? applicantId.toString() : null)
                .correlationId(correlationId)
                .event(event)
                .createdAt(now)
                .build());
        log.info("Audit {} staged for tenant {} (outbox id={})", action, tenantId, staged.getId());
    }
}
