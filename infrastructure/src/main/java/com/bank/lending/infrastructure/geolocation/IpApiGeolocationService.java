package com.bank.lending.infrastructure.geolocation;

import com.bank.lending.domain.geolocation.GeolocationService;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Approximate IP location through ip-api.com (free tier, no key, rate limited).
 *
 * Private and loopback addresses resolve to "Local/Privada" without a network call.
 * Anything that is not an IPv4 or IPv6 literal is never sent.
 * Lookups go through a time limiter, a circuit breaker and a retry; every failure maps to an empty result.
 * Successful lookups are cached per IP.
 */
@Component
public class IpApiGeolocationService implements GeolocationService {

    private static final Logger log = LoggerFactory.getLogger(IpApiGeolocationService.class);

    static final String PRIVATE_LOCATION = "Local/Privada";
    private static final Pattern PRIVATE_172 = Pattern.compile("^172\\.(1[6-9]|2\\d|3[01])\\..*");
    private static final Pattern IPV4 = Pattern.compile(
            "^((25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)\\.){3}(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)$");
    private static final Pattern IPV6 = Pattern.compile("^[0-9A-Fa-f]{0,4}(:[0-9A-Fa-f]{0,4}){2,7}$");
    private static final String FIELDS = "status,city,regionName,country";

    private final RestTemplate restTemplate;
    private final String baseUrl;
    private final boolean enabled;
    private final CircuitBreaker circuitBreaker;
    private final Retry retry;
    private final TimeLimiter timeLimiter;
    private final Cache<String, String> locations;

    public IpApiGeolocationService(
            @Qualifier("geolocationRestTemplate") RestTemplate restTemplate,
            @Value("${app.geolocation.base-url:http://ip-api.com/json}") String baseUrl,
            @Value("${app.geolocation.enabled:true}") boolean enabled,
            @Qualifier("geolocationCircuitBreaker") CircuitBreaker circuitBreaker,
            @Qualifier("geolocationRetry") Retry retry,
            @Qualifier("geolocationTimeLimiter") TimeLimiter timeLimiter) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl;
        this.enabled = enabled;
        this.circuitBreaker = circuitBreaker;
        this.retry = retry;
        this.timeLimiter = timeLimiter;
        this.locations = Caffeine.newBuilder()
                .maximumSize(10_000)
                .expireAfterWrite(6, TimeUnit.HOURS)
                .build();
    }

    @Override
    public Optional<String> locate(String ipAddress) {
        if (ipAddress == null || ipAddress.isBlank()) {
            return Optional.empty();
        }
        if (!isIpLiteral(ipAddress)) {
            log.debug("Not an IP literal, skipping lookup");
            return Optional.empty();
        }
        if (isPrivate(ipAddress)) {
            return Optional.of(PRIVATE_LOCATION);
        }
        if (!enabled) {
            log.debug("Geolocation disabled, skipping lookup for {}", ipAddress);
            return Optional.empty();
        }

        String cached = locations.getIfPresent(ipAddress);
        if (cached != null) {
            return Optional.of(cached);
        }

        try {
            Optional<String> location = timeLimiter.executeFutureSupplier(
                    () -> CompletableFuture.supplyAsync(
                            () -> circuitBreaker.executeSupplier(
                                    () -> retry.executeSupplier(() -> fetch(ipAddress)))));
            location.ifPresent(value -> locations.put(ipAddress, value));
            return location;
        } catch (Exception e) {
            log.warn("Geolocation lookup failed for {}: {}", ipAddress, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<String> fetch(String ipAddress) {
        try {
            @SuppressWarnings("unchecked")
            Map<String, Object> body = restTemplate.getForObject(lookupUri(ipAddress), Map.class);
            if (body == null || !"success".equals(body.get("status"))) {
                log.debug("Geolocation returned no result for {}: {}", ipAddress, body);
                return Optional.empty();
            }
            String joined = Stream.of(body.get("city"), body.get("regionName"), body.get("country"))
                    .filter(Objects::nonNull)
                    .map(Object::toString)
                    .filter(part -> !part.isBlank())
                    .collect(Collectors.joining(", "));
            return joined.isEmpty() ? Optional.empty() : Optional.of(joined);
        } catch (RestClientException e) {
            log.debug("Error calling geolocation service for {}: {}", ipAddress, e.getMessage());
            throw new IllegalStateException("Geolocation service unavailable", e);
        }
    }

    URI lookupUri(String ipAddress) {
        return UriComponentsBuilder.fromHttpUrl(baseUrl)
                .pathSegment(ipAddress)
                .queryParam("fields", FIELDS)
                .queryParam("lang", "es")
                .encode()
                .build()
                .toUri();
    }

    static boolean isIpLiteral(String ipAddress) {
        return IPV4.matcher(ipAddress).matches() || IPV6.matcher(ipAddress).matches();
    }

    static boolean isPrivate(String ipAddress) {
        return ipAddress.equals("127.0.0.1")
                || ipAddress.equals("::1")
                || ipAddress.startsWith("192.168.")
                || ipAddress.startsWith("10.")
                || PRIVATE_172.matcher(ipAddress).matches();
    }
}
