package com.letably.database.migration;

import static org.assertj.core.api.Assertions.assertThat;

import com.letably.database.EmbeddedDatabase;
import com.letably.database.gateway.SqlDialect;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link MigrationService} against the embedded schema.
 */
@DisplayName("MigrationService")
class MigrationServiceTest {

    private EmbeddedDatabase db;

    @BeforeEach
    void setUp() {
        db = EmbeddedDatabase.start();
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    @Nested
    @DisplayName("status")
    class Status {

        @Test
        @DisplayName("reports the applied reporting schema")
        void appliedSchema() {
            MigrationService.DatabaseStatus status = db.migrations().status();

            assertThat(status.location()).isEqualTo(SqlDialect.H2.migrationLocation());
            assertThat(status.appliedMigrations()).isEqualTo(1);
            assertThat(status.pendingMigrations()).isZero();
            assertThat(status.currentVersion()).isEqualTo("1");
        }

        @Test
        @DisplayName("a second migrate applies nothing")
        void idempotent() {
            assertThat(db.migrations().migrate()).isZero();
        }
    }

    @Nested
    @DisplayName("history")
    class History {

        @Test
        @DisplayName("lists the schema script as successful")
        void lists() {
            assertThat(db.migrations().history())
                    .singleElement()
                    .satisfies(info -> {
                        assertThat(info.version()).isEqualTo("1");
                        assertThat(info.description()).isEqualTo("reporting schema");
                        assertThat(info.state()).isEqualTo("SUCCESS");
                        assertThat(info.installedOn()).isNotNull();
                    });
        }
    }

    @Nested
    @DisplayName("records")
    class Records {

        @Test
        @DisplayName("zero migrations is a valid initial state")
        void zeroMigrationsValid() {
            var status = new MigrationService.DatabaseStatus("classpath:db/migration/postgres", 0, 1, null);

            assertThat(status.appliedMigrations()).isZero();
            assertThat(status.currentVersion()).isNull();
        }
    }
}
