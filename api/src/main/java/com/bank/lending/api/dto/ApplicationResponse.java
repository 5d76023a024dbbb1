package com.bank.lending.api.dto;

import com.bank.lending.domain.model.StatusHistoryEntry;
import com.bank.lending.domain.model.TimelineEntry;
import com.bank.lending.infrastructure.persistence.entity.ApplicationEntity;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;

@Value
@Builder
public class ApplicationResponse {

    Long id;
    String folio;
    String productCode;
    String status;
    String statusLabel;
    String purpose;
    BigDecimal requestedAmount;
    Integer termMonths;
    OffsetDateTime submittedAt;
    OffsetDateTime approvedAt;
    String rejectionReason;
    OffsetDateTime disbursedAt;
    OffsetDateTime createdAt;
    OffsetDateTime updatedAt;
    List<StatusHistoryEntry> statusHistory;
    List<TimelineEntry> timeline;

    public static ApplicationResponse from(ApplicationEntity application) {
        return ApplicationResponse.builder()
                .id(application.getId())
                .folio(application.getFolio())
                .productCode(application.getProductCode())
                .status(application.getStatus().name())
                .statusLabel(application.getStatus().getLabel())
                .purpose(application.getPurpose())
                .requestedAmount(application.getRequestedAmount())
                .termMonths(application.getTermMonths())
                .submittedAt(application.getSubmittedAt())
                .approvedAt(application.getApprovedAt())
                .rejectionReason(application.getRejectionReason())
                .disbursedAt(application.getDisbursedAt())
                .createdAt(application.getCreatedAt())
                .updatedAt(application.getUpdatedAt())
                .statusHistory(application.statusHistory().entries())
                .timeline(application.timeline().entries())
                .build();
    }
}
