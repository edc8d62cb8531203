package com.letably.database.gateway;

import com.letably.database.SqlErrorTranslator;
import com.letably.database.migration.MigrationService;
import com.letably.database.migration.SchemaMigrations;
import com.letably.database.tenant.TenantContextEnforcer;
import com.letably.database.tenant.TenantSessionBinder;
import com.letably.observability.QueryMetrics;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the connection pool, schema migrations and the execution gateway.
 *
 * <p>Services using this configuration should disable Spring Boot's own Flyway run, since the
 * migration folders are per dialect:
 *
 * <pre>{@code
 * spring:
 *   flyway:
 *     enabled: false
 * }</pre>
 *
 * @see GatewayProperties
 */
@Configuration
@EnableConfigurationProperties(GatewayProperties.class)
@ConditionalOnProperty(prefix = "letably.gateway", name = "url")
public class GatewayConfig {

    private static final Logger log = LoggerFactory.getLogger(GatewayConfig.class);

    /** Pool name, visible in HikariCP logs and metrics. */
    public static final String POOL_NAME = "letably-gateway";

    @Bean(destroyMethod = "close")
    public HikariDataSource gatewayDataSource(GatewayProperties properties) {
        HikariConfig config = new HikariConfig();
        config.setPoolName(POOL_NAME);
        config.setJdbcUrl(properties.url());
        config.setUsername(properties.username());
        config.setPassword(properties.password());
        config.setMaximumPoolSize(properties.maximumPoolSize());
        config.setConnectionTimeout(properties.connectionTimeout().toMillis());
        config.setIdleTimeout(properties.idleTimeout().toMillis());
        log.info("Creating {} pool for {} (dialect {}, max {} connections)",
                POOL_NAME, properties.url(), properties.dialect(), properties.maximumPoolSize());
        return new HikariDataSource(config);
    }

    @Bean
    public TenantSessionBinder tenantSessionBinder(GatewayProperties properties) {
        return properties.dialect().sessionBinder();
    }

    @Bean
    public MigrationService migrationService(HikariDataSource dataSource, GatewayProperties properties) {
        MigrationService service = SchemaMigrations.forLocation(dataSource, properties.migrationLocation());
        if (properties.migration().enabled()) {
            service.migrate();
        } else {
            log.info("Schema migration disabled; expecting {} to be applied", properties.migrationLocation());
        }
        return service;
    }

    @Bean
    public QueryMetrics gatewayQueryMetrics(ObjectProvider<MeterRegistry> registry, GatewayProperties properties) {
        return new QueryMetrics(registry.getIfAvailable(SimpleMeterRegistry::new), properties.serviceName());
    }

    /**
     * The enforcer depends on the migration bean so that no scoped call can run before the schema
     * and its isolation policies exist.
     */
    @Bean
    public TenantContextEnforcer tenantContextEnforcer(
            HikariDataSource dataSource,
            TenantSessionBinder binder,
            GatewayProperties properties,
            MigrationService migrationService) {
        log.debug("Tenant context enforcer ready, schema at {}", migrationService.status().currentVersion());
        return new TenantContextEnforcer(
                dataSource,
                binder,
                dataSource::evictConnection,
                new SqlErrorTranslator(properties.retryBackoff()),
                properties.statementTimeout());
    }

    @Bean
    public ExecutionGateway executionGateway(TenantContextEnforcer enforcer, QueryMetrics gatewayQueryMetrics) {
        return new ExecutionGateway(enforcer, gatewayQueryMetrics);
    }
}
