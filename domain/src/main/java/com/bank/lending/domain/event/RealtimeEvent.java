package com.bank.lending.domain.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Envelope for realtime broadcasts
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RealtimeEvent {
    private String event;
    private List<String> channels;
    private OffsetDateTime publishedAt;
    private Object data;
}
