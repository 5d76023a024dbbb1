package com.bank.lending.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.OffsetDateTime;

/**
 * One applied correction of a rejected field.
 * Values are either scalars (String) or composite maps.
 */
@Value
@Builder
@Jacksonized
public class CorrectionEntry {

    @JsonProperty("old_value")
    Object oldValue;

    @JsonProperty("new_value")
    Object newValue;

    @JsonProperty("rejection_reason")
    String rejectionReason;

    @JsonProperty("corrected_by")
    Actor correctedBy;

    @JsonProperty("corrected_at")
    OffsetDateTime correctedAt;
}
