package com.bank.lending.infrastructure.persistence.entity;

import com.bank.lending.domain.event.AuditEvent;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;

/**
 * Audit record staged in the same transaction as the change it describes.
 * A row is pending until {@code publishedAt} is set by the dispatcher.
 */
@Entity
@Table(name = "audit_outbox", indexes = {
    @Index(name = "idx_audit_outbox_pending", columnList = "published_at, id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditOutboxEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "action", nullable = false, length = 60)
    private String action;

    @Column(name = "tenant_id")
    private Long tenantId;

    @Column(name = "message_key", length = 100)
    private String messageKey;

    @Column(name = "correlation_id", length = 100)
    private String correlationId;

    @Column(name = "event", nullable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private AuditEvent event;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    @Column(name = "published_at")
    private OffsetDateTime publishedAt;

    @Column(name = "attempts", nullable = false)
    @Builder.Default
    private int attempts = 0;

    @Column(name = "last_error", length = 1000)
    private String lastError;

    public boolean isPublished() {
        return publishedAt != null;
    }
}
