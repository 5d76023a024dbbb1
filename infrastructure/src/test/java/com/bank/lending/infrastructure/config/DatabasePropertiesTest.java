package com.bank.lending.infrastructure.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DatabasePropertiesTest {

    @Test
    void testSqlServerSelectsItsMigrationsAndDialect() {
        // Given
        Binder binder = new Binder(new MapConfigurationPropertySource(Map.of("app.database.type", "sqlserver")));

        // When
        DatabaseProperties properties = binder.bind("app.database", Bindable.of(DatabaseProperties.class)).get();

        // Then
        assertEquals(DatabaseProperties.DatabaseType.SQLSERVER, properties.getType());
        assertEquals("classpath:db/migration/sqlserver", properties.getType().getMigrationLocation());
        assertEquals("org.hibernate.dialect.SQLServerDialect", properties.getType().getDialect());
    }

    @Test
    void testPostgresqlIsTheDefault() {
        DatabaseProperties properties = new DatabaseProperties();

        assertEquals(DatabaseProperties.DatabaseType.POSTGRESQL, properties.getType());
        assertEquals("classpath:db/migration/postgresql", properties.getType().getMigrationLocation());
    }
}
