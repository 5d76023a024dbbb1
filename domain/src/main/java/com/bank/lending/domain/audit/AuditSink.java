package com.bank.lending.domain.audit;

import com.bank.lending.domain.enums.AuditAction;

import java.util.Map;

/**
 * Append-only audit log. Payload carries the actor, entity references and old/new snapshots.
 */
public interface AuditSink {

    void emit(AuditAction action, Long tenantId, Map<String, Object> payload);
}
