package com.bank.lending.application.model;

import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;

@Value
@Builder
public class RejectedDocumentView {

    Long id;
    Long applicationId;
    String type;
    String typeLabel;
    String fileName;
    String rejectionReason;
    OffsetDateTime rejectedAt;
}
