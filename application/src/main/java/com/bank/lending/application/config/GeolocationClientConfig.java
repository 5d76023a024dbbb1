package com.bank.lending.application.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * Configuration for the IP geolocation client
 *
 * Configuration via application.yml:
 *   app.geolocation.enabled: true | false (default: true)
 *   app.geolocation.base-url: "http://ip-api.com/json"
 *   app.geolocation.timeout: 2s
 */
@Configuration
public class GeolocationClientConfig {

    /**
     * RestTemplate bean for the geolocation REST client
     */
    @Bean("geolocationRestTemplate")
    public RestTemplate geolocationRestTemplate(
            RestTemplateBuilder builder,
            @Value("${app.geolocation.timeout:2s}") Duration timeout) {
        return builder
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout)
                .build();
    }
}
