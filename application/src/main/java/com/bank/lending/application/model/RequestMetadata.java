package com.bank.lending.application.model;

import lombok.AllArgsConstructor;
import lombok.Value;
import lombok.With;

/**
 * Client details recorded on correction timeline entries.
 * The location is resolved before the correction transaction starts.
 */
@Value
@AllArgsConstructor
public class RequestMetadata {

    String ipAddress;
    String userAgent;
    @With
    String location;

    public RequestMetadata(String ipAddress, String userAgent) {
        this(ipAddress, userAgent, null);
    }

    public static RequestMetadata empty() {
        return new RequestMetadata(null, null, null);
    }
}
