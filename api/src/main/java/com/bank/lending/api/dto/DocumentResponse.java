package com.bank.lending.api.dto;

import com.bank.lending.infrastructure.persistence.entity.DocumentEntity;
import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;

@Value
@Builder
public class DocumentResponse {

    Long id;
    Long applicationId;
    String type;
    String typeLabel;
    String status;
    String fileName;
    String rejectionReason;
    OffsetDateTime uploadedAt;
    OffsetDateTime reviewedAt;

    public static DocumentResponse from(DocumentEntity document) {
        return DocumentResponse.builder()
                .id(document.getId())
                .applicationId(document.getApplicationId())
                .type(document.getType().name())
                .typeLabel(document.getType().getDescription())
                .status(document.getStatus().name())
                .fileName(document.getFileName())
                .rejectionReason(document.getRejectionReason())
                .uploadedAt(document.getUploadedAt())
                .reviewedAt(document.getReviewedAt())
                .build();
    }
}
