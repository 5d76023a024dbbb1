package com.bank.lending.infrastructure.persistence.entity;

import com.bank.lending.domain.enums.EmploymentType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

/**
 * JPA entity for applicant employment records
 */
@Entity
@Table(name = "employment_record", indexes = {
    @Index(name = "idx_employment_applicant_id", columnList = "applicant_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmploymentRecordEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "applicant_id", nullable = false)
    private Long applicantId;

    @Column(name = "is_current", nullable = false)
    @Builder.Default
    private boolean currentRecord = true;

    @Enumerated(EnumType.STRING)
    @Column(name = "employment_type", length = 30)
    private EmploymentType employmentType;

    @Column(name = "company_name", length = 255)
    private String companyName;

    @Column(name = "position", length = 255)
    private String position;

    @Column(name = "monthly_income", precision = 14, scale = 2)
    private BigDecimal monthlyIncome;

    @Column(name = "seniority_months")
    private Integer seniorityMonths;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;
}
