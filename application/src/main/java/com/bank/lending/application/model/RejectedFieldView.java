package com.bank.lending.application.model;

import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;

@Value
@Builder
public class RejectedFieldView {

    Long id;
    String fieldName;
    String fieldLabel;
    Object currentValue;
    String rejectionReason;
    OffsetDateTime rejectedAt;
}
