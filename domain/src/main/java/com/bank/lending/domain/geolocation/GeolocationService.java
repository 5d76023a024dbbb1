package com.bank.lending.domain.geolocation;

import java.util.Optional;

/**
 * Approximate location of a client IP, used only to enrich timeline entries.
 * Implementations never throw; any failure yields an empty result.
 */
public interface GeolocationService {

    Optional<String> locate(String ipAddress);
}
