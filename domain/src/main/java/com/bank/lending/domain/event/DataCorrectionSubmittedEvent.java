package com.bank.lending.domain.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Broadcast after an applicant corrects a rejected field
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DataCorrectionSubmittedEvent {

    public static final String EVENT_NAME = "data.correction.submitted";

    @JsonProperty("verification_id")
    private Long verificationId;

    @JsonProperty("applicant_id")
    private Long applicantId;

    @JsonProperty("tenant_id")
    private Long tenantId;

    @JsonProperty("applicant_name")
    private String applicantName;

    @JsonProperty("field_name")
    private String fieldName;

    @JsonProperty("field_label")
    private String fieldLabel;

    @JsonProperty("old_value")
    private Object oldValue;

    @JsonProperty("new_value")
    private Object newValue;

    @JsonProperty("corrected_by")
    private String correctedBy;

    @JsonProperty("correction_count")
    private int correctionCount;

    @JsonProperty("corrected_at")
    private OffsetDateTime correctedAt;

    /**
     * Applicant channel plus tenant admin channel
     */
    public List<String> channels() {
        return List.of(
                String.format("tenant.%d.applicant.%d", tenantId, applicantId),
                String.format("tenant.%d.admin", tenantId));
    }
}
