package com.bank.lending.infrastructure.persistence.entity;

import com.bank.lending.domain.enums.VerifiableField;
import com.bank.lending.domain.enums.VerificationStatus;
import com.bank.lending.domain.model.CorrectionEntry;
import com.bank.lending.domain.model.HistoryLog;
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

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * JPA entity for per-field verification state, one row per (applicant, field)
 */
@Entity
@Table(name = "data_verification",
    uniqueConstraints = @UniqueConstraint(name = "uk_verification_applicant_field",
            columnNames = {"applicant_id", "field_name"}),
    indexes = @Index(name = "idx_verification_applicant_status", columnList = "applicant_id, status"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DataVerificationEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false)
    private Long tenantId;

    @Column(name = "applicant_id", nullable = false)
    private Long applicantId;

    @Enumerated(EnumType.STRING)
    @Column(name = "field_name", nullable = false, length = 30)
    private VerifiableField fieldName;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private VerificationStatus status;

    @Column(name = "field_value", columnDefinition = "text")
    private String fieldValue;

    @Column(name = "rejection_reason", length = 1000)
    private String rejectionReason;

    @Column(name = "rejected_at")
    private OffsetDateTime rejectedAt;

    @Column(name = "corrected_at")
    private OffsetDateTime correctedAt;

    @Column(name = "verified_at")
    private OffsetDateTime verifiedAt;

    @Column(name = "verified_by")
    private Long verifiedBy;

    @Column(name = "notes", length = 1000)
    private String notes;

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    @Column(name = "correction_history", nullable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    @Builder.Default
    private List<CorrectionEntry> correctionHistory = new ArrayList<>();

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    public HistoryLog<CorrectionEntry> correctionHistory() {
        return HistoryLog.of(correctionHistory);
    }

    public void appendCorrection(CorrectionEntry entry) {
        this.correctionHistory = new ArrayList<>(correctionHistory().append(entry).entries());
    }

    public boolean isRejected() {
        return status == VerificationStatus.REJECTED;
    }
}
