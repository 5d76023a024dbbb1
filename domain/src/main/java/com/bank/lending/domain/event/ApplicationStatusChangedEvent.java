package com.bank.lending.domain.event;

import com.bank.lending.domain.enums.ApplicationStatus;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Broadcast after an application changes status
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApplicationStatusChangedEvent {

    public static final String EVENT_NAME = "application.status.changed";

    @JsonProperty("application_id")
    private Long applicationId;

    @JsonProperty("applicant_id")
    private Long applicantId;

    @JsonProperty("tenant_id")
    private Long tenantId;

    @JsonProperty("folio")
    private String folio;

    @JsonProperty("from")
    private ApplicationStatus from;

    @JsonProperty("to")
    private ApplicationStatus to;

    @JsonProperty("reason")
    private String reason;

    @JsonProperty("changed_at")
    private OffsetDateTime changedAt;

    public List<String> channels() {
        return List.of(
                String.format("tenant.%d.applicant.%d", tenantId, applicantId),
                String.format("tenant.%d.admin", tenantId));
    }
}
