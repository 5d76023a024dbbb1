package com.bank.lending.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.hibernate.cfg.AvailableSettings;
import org.hibernate.type.format.jackson.JacksonJsonFormatMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.orm.jpa.HibernatePropertiesCustomizer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

/**
 * Hibernate dialect of the configured database type. JSON history columns and staged audit
 * events are (de)serialized with the application ObjectMapper.
 */
@Configuration
@EnableConfigurationProperties(DatabaseProperties.class)
public class JpaConfig {

    private static final Logger log = LoggerFactory.getLogger(JpaConfig.class);

    @Bean
    public HibernatePropertiesCustomizer hibernatePropertiesCustomizer(ObjectMapper objectMapper,
                                                                       DatabaseProperties databaseProperties) {
        return (Map<String, Object> hibernateProperties) -> {
            String dialect = databaseProperties.getType().getDialect();
            log.info("Configuring Hibernate with {}", dialect);
            hibernateProperties.put(AvailableSettings.DIALECT, dialect);
            hibernateProperties.put(AvailableSettings.JSON_FORMAT_MAPPER, new JacksonJsonFormatMapper(objectMapper));
        };
    }
}
