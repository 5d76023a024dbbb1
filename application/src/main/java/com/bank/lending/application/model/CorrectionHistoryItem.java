package com.bank.lending.application.model;

import com.bank.lending.domain.model.Actor;
import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;

/**
 * One correction entry flattened out of its verification row
 */
@Value
@Builder
public class CorrectionHistoryItem {

    Long verificationId;
    String fieldName;
    String fieldLabel;
    Object oldValue;
    Object newValue;
    String rejectionReason;
    Actor correctedBy;
    OffsetDateTime correctedAt;
}
