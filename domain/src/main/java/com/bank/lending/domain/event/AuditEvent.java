package com.bank.lending.domain.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.Map;

/**
 * Audit record as published to the audit topic
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditEvent {
    private String action;
    private Long tenantId;
    private String correlationId;
    private OffsetDateTime occurredAt;
    private Map<String, Object> payload;
}
