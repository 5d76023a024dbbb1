package com.bank.lending.application.model;

import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;
import java.util.List;

@Value
@Builder
public class CorrectionResult {

    Long verificationId;
    String fieldName;
    String fieldLabel;
    String status;
    int correctionCount;
    OffsetDateTime correctedAt;
    List<Long> applicationsAdvanced;
    String reconciliationReason;
}
