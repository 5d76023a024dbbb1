package com.bank.lending.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Narrative entry on the application timeline (status changes, corrections, uploads, reviews)
 */
@Value
@Builder
@Jacksonized
public class TimelineEntry {

    @JsonProperty("action")
    String action;

    @JsonProperty("actor_id")
    Long actorId;

    @JsonProperty("actor_name")
    String actorName;

    @JsonProperty("timestamp")
    OffsetDateTime timestamp;

    @JsonProperty("payload")
    Map<String, Object> payload;

    public static TimelineEntry of(String action, Map<String, Object> payload, Actor actor, OffsetDateTime timestamp) {
        return TimelineEntry.builder()
                .action(action)
                .actorId(actor != null ? actor.getId() : null)
                .actorName(actor != null ? actor.getName() : null)
                .timestamp(timestamp)
                .payload(payload != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(payload))
                        : Collections.emptyMap())
                .build();
    }

    /**
     * Payload value as string, or null when absent
     */
    @JsonIgnore
    public String payloadString(String key) {
        if (payload == null) {
            return null;
        }
        Object value = payload.get(key);
        return value != null ? value.toString() : null;
    }
}
