package com.bank.lending.infrastructure.geolocation;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IpApiGeolocationServiceTest {

    private static final URI URL = URI.create("http://ip-api.com/json/201.141.10.1?fields=status,city,regionName,country&lang=es");

    @Mock
    private RestTemplate restTemplate;

    private IpApiGeolocationService service;

    @BeforeEach
    void setUp() {
        Retry retry = Retry.of("geolocation-test", RetryConfig.custom()
                .maxAttempts(2)
                .waitDuration(Duration.ofMillis(10))
                .build());
        service = new IpApiGeolocationService(restTemplate, "http://ip-api.com/json", true,
                CircuitBreaker.ofDefaults("geolocation-test"), retry, TimeLimiter.ofDefaults("geolocation-test"));
    }

    @Test
    void testPrivateAddressesSkipLookup() {
        assertEquals(Optional.of("Local/Privada"), service.locate("127.0.0.1"));
        assertEquals(Optional.of("Local/Privada"), service.locate("192.168.1.20"));
        assertEquals(Optional.of("Local/Privada"), service.locate("172.20.0.3"));
        verifyNoInteractions(restTemplate);
    }

    @Test
    void testPublicAddressIsResolvedAndCached() {
        // Given
        when(restTemplate.getForObject(URL, Map.class)).thenReturn(Map.of(
                "status", "success",
                "city", "Guadalajara",
                "regionName", "Jalisco",
                "country", "México"));

        // When
        Optional<String> first = service.locate("201.141.10.1");
        Optional<String> second = service.locate("201.141.10.1");

        // Then
        assertEquals(Optional.of("Guadalajara, Jalisco, México"), first);
        assertEquals(first, second);
        verify(restTemplate, times(1)).getForObject(URL, Map.class);
    }

    @Test
    void testFailedLookupIsEmpty() {
        // Given
        when(restTemplate.getForObject(any(URI.class), eq(Map.class)))
                .thenThrow(new ResourceAccessException("Connection refused"));

        // When
        Optional<String> location = service.locate("201.141.10.1");

        // Then
        assertTrue(location.isEmpty());
        verify(restTemplate, times(2)).getForObject(any(URI.class), eq(Map.class));
    }

    @Test
    void testUnsuccessfulStatusIsEmpty() {
        when(restTemplate.getForObject(URL, Map.class)).thenReturn(Map.of("status", "fail"));

        assertTrue(service.locate("201.141.10.1").isEmpty());
    }

    @Test
    void testNonLiteralAddressIsNeverSent() {
        assertTrue(service.locate("201.141.10.1/../../admin?x=").isEmpty());
        assertTrue(service.locate("evil.example.com").isEmpty());
        assertTrue(service.locate("201.141.10.1#frag").isEmpty());
        assertTrue(service.locate("300.1.1.1").isEmpty());
        verifyNoInteractions(restTemplate);
    }

    @Test
    void testIpv6AddressIsLookedUpAsOnePathSegment() {
        assertTrue(IpApiGeolocationService.isIpLiteral("2001:db8::1"));
        assertTrue(IpApiGeolocationService.isIpLiteral("::1"));
        assertEquals(URI.create("http://ip-api.com/json/2001:db8::1?fields=status,city,regionName,country&lang=es"),
                service.lookupUri("2001:db8::1"));
    }

    @Test
    void testBlankAddress() {
        assertTrue(service.locate(null).isEmpty());
        assertTrue(service.locate(" ").isEmpty());
        verifyNoInteractions(restTemplate);
    }

    @Test
    void testDisabledLookup() {
        IpApiGeolocationService disabled = new IpApiGeolocationService(restTemplate, "http://ip-api.com/json", false,
                CircuitBreaker.ofDefaults("disabled"), Retry.ofDefaults("disabled"), TimeLimiter.ofDefaults("disabled"));

        assertTrue(disabled.locate("201.141.10.1").isEmpty());
        verifyNoInteractions(restTemplate);
    }
}
