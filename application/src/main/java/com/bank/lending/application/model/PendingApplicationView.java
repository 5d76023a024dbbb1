package com.bank.lending.application.model;

import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;

@Value
@Builder
public class PendingApplicationView {

    Long id;
    String folio;
    String status;
    String statusLabel;
    OffsetDateTime updatedAt;
}
