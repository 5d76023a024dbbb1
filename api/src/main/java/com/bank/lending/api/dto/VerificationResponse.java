package com.bank.lending.api.dto;

import com.bank.lending.infrastructure.persistence.entity.DataVerificationEntity;
import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;

@Value
@Builder
public class VerificationResponse {

    Long id;
    String fieldName;
    String fieldLabel;
    String status;
    String statusLabel;
    String rejectionReason;
    OffsetDateTime verifiedAt;
    OffsetDateTime rejectedAt;
    int correctionCount;

    public static VerificationResponse from(DataVerificationEntity verification) {
        return VerificationResponse.builder()
                .id(verification.getId())
                .fieldName(verification.getFieldName().getCode())
                .fieldLabel(verification.getFieldName().getLabel())
                .status(verification.getStatus().name())
                .statusLabel(verification.getStatus().getLabel())
                .rejectionReason(verification.getRejectionReason())
                .verifiedAt(verification.getVerifiedAt())
                .rejectedAt(verification.getRejectedAt())
                .correctionCount(verification.correctionHistory().size())
                .build();
    }
}
