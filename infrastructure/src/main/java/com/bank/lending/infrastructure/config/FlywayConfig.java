package com.bank.lending.infrastructure.config;

import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.output.MigrateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.flyway.FlywayProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import javax.sql.DataSource;

/**
 * Migrates the loan-origination schema (applicants, applications, verifications, documents,
 * references and the audit outbox) from the folder of the configured database type.
 * Runs eagerly so the schema exists before the EntityManagerFactory starts.
 */
@Configuration
@EnableConfigurationProperties({FlywayProperties.class, DatabaseProperties.class})
public class FlywayConfig {

    private static final Logger log = LoggerFactory.getLogger(FlywayConfig.class);

    @Bean
    @Primary
    public Flyway flyway(DataSource dataSource, FlywayProperties flywayProperties, DatabaseProperties databaseProperties) {
        DatabaseProperties.DatabaseType type = databaseProperties.getType();
        log.info("Migrating {} schema from {}", type, type.getMigrationLocation());

        Flyway flyway = Flyway.configure()
                .dataSource(dataSource)
                .locations(type.getMigrationLocation())
                .baselineOnMigrate(flywayProperties.isBaselineOnMigrate())
                .validateOnMigrate(flywayProperties.isValidateOnMigrate())
                .load();

        MigrateResult result = flyway.migrate();
        log.info("Schema at version {} ({} migration(s) applied)", result.targetSchemaVersion, result.migrationsExecuted);
        return flyway;
    }
}
