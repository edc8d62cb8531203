package com.letably.database.migration;

import javax.sql.DataSource;
import org.flywaydb.core.Flyway;

/**
 * Creates the Flyway instance for the reporting schema.
 */
public final class SchemaMigrations {

    private SchemaMigrations() {
        // utility class
    }

    /**
     * Configures Flyway for one location. Clean is always disabled.
     *
     * @param dataSource connection source; migrations run through it without agency context
     * @param location   e.g. {@code classpath:db/migration/postgres}
     */
    public static MigrationService forLocation(DataSource dataSource, String location) {
        Flyway flyway = Flyway.configure()
                .dataSource(dataSource)
                .locations(location)
                .baselineOnMigrate(true)
                .cleanDisabled(true)
                .load();
        return new MigrationService(flyway, location);
    }
}
