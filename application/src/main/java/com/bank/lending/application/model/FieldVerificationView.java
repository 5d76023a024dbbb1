package com.bank.lending.application.model;

import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;

/**
 * Detail of one verification row as shown to the applicant
 */
@Value
@Builder
public class FieldVerificationView {

    Long id;
    String fieldName;
    String fieldLabel;
    Object currentValue;
    String status;
    String statusLabel;
    String rejectionReason;
    OffsetDateTime rejectedAt;
    OffsetDateTime correctedAt;
    boolean rejected;
    int correctionCount;
}
