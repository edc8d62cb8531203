package com.letably.database.gateway;

import com.letably.database.tenant.H2TenantSessionBinder;
import com.letably.database.tenant.PostgresTenantSessionBinder;
import com.letably.database.tenant.TenantSessionBinder;

import java.util.Locale;

/**
 * Database dialects the gateway can scope sessions on.
 */
public enum SqlDialect {

    /** Production database; isolation through row-level security policies. */
    POSTGRES("classpath:db/migration/postgres") {
        @Override
        public TenantSessionBinder sessionBinder() {
            return new PostgresTenantSessionBinder();
        }
    },

    /** Embedded database for development and tests; isolation through filtering views. */
    H2("classpath:db/migration/h2") {
        @Override
        public TenantSessionBinder sessionBinder() {
            return new H2TenantSessionBinder();
        }
    };

    private final String migrationLocation;

    SqlDialect(String migrationLocation) {
        this.migrationLocation = migrationLocation;
    }

    public abstract TenantSessionBinder sessionBinder();

    /** Flyway location holding this dialect's schema. */
    public String migrationLocation() {
        return migrationLocation;
    }

    /**
     * Derives the dialect from a JDBC URL.
     *
     * @throws IllegalArgumentException for unsupported databases
     */
    public static SqlDialect fromUrl(String jdbcUrl) {
        String url = jdbcUrl == null ? "" : jdbcUrl.toLowerCase(Locale.ROOT);
        if (url.startsWith("jdbc:postgresql:")) {
            return POSTGRES;
        }
        if (url.startsWith("jdbc:h2:")) {
            return H2;
        }
        throw new IllegalArgumentException("Unsupported JDBC URL: " + jdbcUrl);
    }
}
