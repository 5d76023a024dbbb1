package com.bank.lending.infrastructure.messaging.outbox;

import com.bank.lending.domain.messaging.MessageProducer;
import com.bank.lending.infrastructure.persistence.entity.AuditOutboxEntity;
import com.bank.lending.infrastructure.persistence.repository.AuditOutboxRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Publishes committed audit records from the outbox to the audit topic, oldest first.
 *
 * Each send is acknowledged by the broker before the row is marked published. The first failure stops the
 * batch so later records of the same applicant never overtake it; the row keeps its attempt count and last
 * error and is retried on the next run. Delivery is at least once: consumers deduplicate on {@code audit-id}.
 */
@Component
@ConditionalOnProperty(name = "app.audit.outbox.dispatcher-enabled", havingValue = "true", matchIfMissing = true)
public class AuditOutboxDispatcher {

    private static final Logger log = LoggerFactory.getLogger(AuditOutboxDispatcher.class);

    private static final int MAX_ERROR_LENGTH = 1000;

    private final AuditOutboxRepository outboxRepository;
    private final MessageProducer messageProducer;
    private final String auditTopic;
    private final int batchSize;
    private final Clock clock;

    public AuditOutboxDispatcher(AuditOutboxRepository outboxRepository,
                                 @Qualifier("kafkaMessageProducer") MessageProducer messageProducer,
                                 @Value("${app.messaging.topics.audit:lending.audit}") String auditTopic,
                                 @Value("${app.audit.outbox.batch-size:100}") int batchSize,
                                 Clock clock) {
        this.outboxRepository = outboxRepository;
        this.messageProducer = messageProducer;
        this.auditTopic = auditTopic;
        this.batchSize = batchSize;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${app.audit.outbox.dispatch-interval-ms:2000}")
    @Transactional
    public void dispatchPending() {
        List<AuditOutboxEntity> batch = outboxRepository.findPending(PageRequest.of(0, batchSize));
        if (batch.isEmpty()) {
            return;
        }

        int published = 0;
        for (AuditOutboxEntity record : batch) {
            try {
                messageProducer.send(auditTopic, record.getMessageKey(), record.getEvent(), headers(record));
            } catch (RuntimeException e) {
                record.setAttempts(record.getAttempts() + 1);
                record.setLastError(truncate(rootMessage(e)));
                outboxRepository.save(record);
                log.error("Failed to publish audit outbox record {} ({}), attempt {}",
                        record.getId(), record.getAction(), record.getAttempts(), e);
                break;
            }
            record.setPublishedAt(OffsetDateTime.now(clock));
            record.setAttempts(record.getAttempts() + 1);
            record.setLastError(null);
            outboxRepository.save(record);
            published++;
        }
        log.info("Published {} of {} pending audit record(s)", published, batch.size());
    }

    private Map<String, String> headers(AuditOutboxEntity record) {
        Map<String, String> headers = new HashMap<>();
        headers.put("audit-id", String.valueOf(record.getId()));
        headers.put("audit-action", record.getAction());
        headers.put("correlation-id", record.getCorrelationId());
        return headers;
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getClass().getSimpleName() + ": " + root.getMessage();
    }

    private static String truncate(String value) {
        return value.length() <= MAX_ERROR_LENGTH ? value : value.substring(0, MAX_ERROR_LENGTH);
    }
}
