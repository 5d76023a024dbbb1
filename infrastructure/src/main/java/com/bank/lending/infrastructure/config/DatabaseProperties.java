package com.bank.lending.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Target database of the service ({@code app.database.type}: postgresql or sqlserver)
 */
@Data
@ConfigurationProperties(prefix = "app.database")
public class DatabaseProperties {

    private DatabaseType type = DatabaseType.POSTGRESQL;

    public enum DatabaseType {
        POSTGRESQL("classpath:db/migration/postgresql", "org.hibernate.dialect.PostgreSQLDialect"),
        SQLSERVER("classpath:db/migration/sqlserver", "org.hibernate.dialect.SQLServerDialect");

        private final String migrationLocation;
        private final String dialect;

        DatabaseType(String migrationLocation, String dialect) {
            this.migrationLocation = migrationLocation;
            this.dialect = dialect;
        }

        public String getMigrationLocation() {
            return migrationLocation;
        }

        public String getDialect() {
            return dialect;
        }
    }
}
