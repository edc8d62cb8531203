package com.letably.database.gateway;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Connection pool and execution settings of the gateway.
 *
 * <p>Bound from the {@code letably.gateway.*} prefix:
 *
 * <pre>
 * letably:
 *   gateway:
 *     url: jdbc:postgresql://localhost:5432/letably
 *     username: letably
 *     password: secret
 *     maximum-pool-size: 20
 *     connection-timeout: 2s
 *     idle-timeout: 30s
 *     statement-timeout: 30s
 *     retry-backoff: 250ms
 *     migration:
 *       enabled: true
 * </pre>
 *
 * @param url               JDBC URL. Required.
 * @param username          database user
 * @param password          database password
 * @param dialect           dialect; derived from the URL when omitted
 * @param maximumPoolSize   pool size (default 20)
 * @param connectionTimeout max wait for a free connection (default 2s)
 * @param idleTimeout       idle connection retirement (default 30s)
 * @param statementTimeout  per-statement timeout (default 30s)
 * @param retryBackoff      backoff hint attached to pool exhaustion failures (default 250ms)
 * @param serviceName       service tag on gateway metrics (default {@code letably})
 * @param migration         schema migration settings
 */
@Validated
@ConfigurationProperties(prefix = "letably.gateway")
public record GatewayProperties(
        @NotBlank String url,
        String username,
        String password,
        SqlDialect dialect,
        @Positive Integer maximumPoolSize,
        Duration connectionTimeout,
        Duration idleTimeout,
        Duration statementTimeout,
        Duration retryBackoff,
        String serviceName,
        @Valid Migration migration) {

    /**
     * Compact constructor applying defaults. Runs before Bean Validation.
     */
    public GatewayProperties {
        if (dialect == null && url != null && !url.isBlank()) {
            dialect = SqlDialect.fromUrl(url);
        }
        if (maximumPoolSize == null) {
            maximumPoolSize = 20;
        }
        if (connectionTimeout == null) {
            connectionTimeout = Duration.ofSeconds(2);
        }
        if (idleTimeout == null) {
            idleTimeout = Duration.ofSeconds(30);
        }
        if (statementTimeout == null) {
            statementTimeout = Duration.ofSeconds(30);
        }
        if (retryBackoff == null) {
            retryBackoff = Duration.ofMillis(250);
        }
        if (serviceName == null || serviceName.isBlank()) {
            serviceName = "letably";
        }
        if (migration == null) {
            migration = new Migration(true, null);
        }
    }

    /** Flyway location of the schema, the dialect's own unless overridden. */
    public String migrationLocation() {
        return migration.locations() != null ? migration.locations() : dialect.migrationLocation();
    }

    /**
     * Schema migration settings.
     *
     * @param enabled   run Flyway on startup (default true)
     * @param locations overrides the dialect's migration location
     */
    public record Migration(Boolean enabled, String locations) {

        public Migration {
            if (enabled == null) {
                enabled = true;
            }
            if (locations != null && locations.isBlank()) {
                locations = null;
            }
        }
    }
}
