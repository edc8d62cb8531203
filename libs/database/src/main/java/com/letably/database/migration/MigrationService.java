package com.letably.database.migration;

import java.util.Arrays;
import java.util.List;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.MigrationInfoService;
import org.flywaydb.core.api.MigrationVersion;
import org.flywaydb.core.api.output.MigrateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the reporting schema and reports its migration state.
 *
 * <p>A POJO around one {@link Flyway} instance, so tests can build it without a Spring context.
 * The schema carried here is the one the gateway's isolation depends on: tenant tables with
 * row-level security on PostgreSQL and filtering views on H2.
 */
public class MigrationService {

    private static final Logger log = LoggerFactory.getLogger(MigrationService.class);

    /**
     * State of one migration script.
     *
     * @param version     migration version (e.g. "1")
     * @param description migration description (e.g. "reporting schema")
     * @param state       Flyway state (e.g. "SUCCESS", "PENDING")
     * @param installedOn ISO-8601 time the script was applied, null when pending
     */
    public record MigrationInfo(String version, String description, String state, String installedOn) {}

    /**
     * Overall migration state of the database.
     *
     * @param location          migration location in use
     * @param appliedMigrations successfully applied scripts
     * @param pendingMigrations scripts waiting to be applied
     * @param currentVersion    current schema version, null before the first migration
     */
    public record DatabaseStatus(
            String location, int appliedMigrations, int pendingMigrations, String currentVersion) {}

    private final Flyway flyway;
    private final String location;

    public MigrationService(Flyway flyway, String location) {
        this.flyway = flyway;
        this.location = location;
    }

    /**
     * Applies pending migrations.
     *
     * @return number of scripts applied by this call
     */
    public int migrate() {
        MigrateResult result = flyway.migrate();
        log.info("Applied {} migration(s) from {}; schema at version {}",
                result.migrationsExecuted, location, result.targetSchemaVersion);
        return result.migrationsExecuted;
    }

    /** Current migration state. */
    public DatabaseStatus status() {
        MigrationInfoService info = flyway.info();
        MigrationVersion current = info.current() == null ? null : info.current().getVersion();
        return new DatabaseStatus(
                location,
                info.applied().length,
                info.pending().length,
                current == null ? null : current.getVersion());
    }

    /** Every known script with its state, in version order. */
    public List<MigrationInfo> history() {
        return Arrays.stream(flyway.info().all())
                .map(m -> new MigrationInfo(
                        m.getVersion() == null ? null : m.getVersion().getVersion(),
                        m.getDescription(),
                        m.getState().name(),
                        m.getInstalledOn() == null ? null : m.getInstalledOn().toInstant().toString()))
                .toList();
    }

    /** Migration location in use. */
    public String location() {
        return location;
    }
}
