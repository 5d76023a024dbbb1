package com.bank.lending.infrastructure.persistence.entity;

import com.bank.lending.domain.enums.ApplicationStatus;
import com.bank.lending.domain.model.HistoryLog;
import com.bank.lending.domain.model.StatusHistoryEntry;
import com.bank.lending.domain.model.TimelineEntry;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * JPA entity for loan applications.
 * Status history and timeline are append-only JSON logs; they are only reachable through
 * {@link #statusHistory()}, {@link #timeline()} and the append methods.
 */
@Entity
@Table(name = "loan_application", indexes = {
    @Index(name = "idx_application_applicant_id", columnList = "applicant_id"),
    @Index(name = "idx_application_status", columnList = "status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApplicationEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false)
    private Long tenantId;

    @Column(name = "applicant_id", nullable = false)
    private Long applicantId;

    @Column(name = "folio", length = 30, unique = true)
    private String folio;

    @Column(name = "product_code", length = 50)
    private String productCode;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 30)
    private ApplicationStatus status;

    @Column(name = "purpose", length = 255)
    private String purpose;

    @Column(name = "requested_amount", precision = 14, scale = 2)
    private BigDecimal requestedAmount;

    @Column(name = "term_months")
    private Integer termMonths;

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    @Column(name = "status_history", nullable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    @Builder.Default
    private List<StatusHistoryEntry> statusHistory = new ArrayList<>();

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    @Column(name = "timeline", nullable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    @Builder.Default
    private List<TimelineEntry> timeline = new ArrayList<>();

    @Column(name = "submitted_at")
    private OffsetDateTime submittedAt;

    @Column(name = "approved_at")
    private OffsetDateTime approvedAt;

    @Column(name = "rejection_reason", length = 1000)
    private String rejectionReason;

    @Column(name = "disbursed_at")
    private OffsetDateTime disbursedAt;

    @Version
    @Column(name = "version")
    private Long version;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    public HistoryLog<StatusHistoryEntry> statusHistory() {
        return HistoryLog.of(statusHistory);
    }

    public HistoryLog<TimelineEntry> timeline() {
        return HistoryLog.of(timeline);
    }

    public void appendStatusHistory(StatusHistoryEntry entry) {
        this.statusHistory = new ArrayList<>(statusHistory().append(entry).entries());
    }

    public void appendTimeline(TimelineEntry entry) {
        this.timeline = new ArrayList<>(timeline().append(entry).entries());
    }
}
