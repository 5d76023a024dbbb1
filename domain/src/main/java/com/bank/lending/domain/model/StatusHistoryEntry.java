package com.bank.lending.domain.model;

import com.bank.lending.domain.enums.ApplicationStatus;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.OffsetDateTime;

/**
 * One applied status transition. {@code from} is null for the entry that opens the application.
 */
@Value
@Builder
@Jacksonized
public class StatusHistoryEntry {

    @JsonProperty("from")
    ApplicationStatus from;

    @JsonProperty("to")
    ApplicationStatus to;

    @JsonProperty("reason")
    String reason;

    @JsonProperty("actor_id")
    Long actorId;

    @JsonProperty("actor_name")
    String actorName;

    @JsonProperty("timestamp")
    OffsetDateTime timestamp;
}
