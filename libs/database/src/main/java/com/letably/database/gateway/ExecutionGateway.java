package com.letably.database.gateway;

import com.letably.database.GatewayException;
import com.letably.database.ResultRow;
import com.letably.database.query.BuiltQuery;
import com.letably.database.query.QueryBuilder;
import com.letably.database.tenant.TenantContextEnforcer;
import com.letably.observability.QueryMetrics;
import com.letably.security.AgencyId;
import com.letably.security.TenantMismatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Entry point for running report SQL against the shared database.
 *
 * <p>Two surfaces with deliberately different names:
 *
 * <ul>
 *   <li>{@code scoped*}: take an explicit {@link AgencyId} and run through the
 *       {@link TenantContextEnforcer}, so only that agency's rows are visible.
 *   <li>{@code system*}: platform-staff operations that run with no agency context. Every call is
 *       logged at INFO with the {@code SYSTEM} marker.
 * </ul>
 *
 * <p>Failures surface as {@link GatewayException} subtypes. The gateway never retries. SQL text is
 * logged; parameter values are not.
 */
public class ExecutionGateway {

    private static final Logger log = LoggerFactory.getLogger(ExecutionGateway.class);

    /** Marker on every unscoped call, for audit filtering. */
    public static final Marker SYSTEM = MarkerFactory.getMarker("SYSTEM");

    static final String SCOPE_SCOPED = "scoped";
    static final String SCOPE_SYSTEM = "system";

    private final TenantContextEnforcer enforcer;
    private final QueryMetrics metrics;

    public ExecutionGateway(TenantContextEnforcer enforcer, QueryMetrics metrics) {
        this.enforcer = Objects.requireNonNull(enforcer, "enforcer");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Runs a query scoped to one agency.
     *
     * @param query    built query
     * @param agencyId agency of the authenticated caller
     * @return all rows, in result order
     */
    public List<ResultRow> scopedQuery(BuiltQuery query, AgencyId agencyId) {
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(agencyId, "agencyId");
        log.debug("Scoped query for agency {}:\n{}", agencyId.value(), query.text());
        return timed(SCOPE_SCOPED, () -> enforcer.withAgency(agencyId, connection -> connection.query(query)));
    }

    /** Builds and runs a query scoped to one agency. */
    public List<ResultRow> scopedQuery(QueryBuilder builder, AgencyId agencyId) {
        return scopedQuery(builder.build(), agencyId);
    }

    /** Runs an insert, update or delete scoped to one agency. */
    public int scopedUpdate(BuiltQuery query, AgencyId agencyId) {
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(agencyId, "agencyId");
        log.debug("Scoped update for agency {}:\n{}", agencyId.value(), query.text());
        return timed(SCOPE_SCOPED, () -> enforcer.withAgency(agencyId, connection -> connection.update(query)));
    }

    /**
     * Runs several statements in one transaction scoped to one agency; commits when {@code work}
     * returns, rolls back when it throws.
     */
    public <T> T inTenantTransaction(AgencyId agencyId, TenantContextEnforcer.ScopedWork<T> work) {
        Objects.requireNonNull(agencyId, "agencyId");
        log.debug("Scoped transaction for agency {}", agencyId.value());
        return timed(SCOPE_SCOPED, () -> enforcer.withAgencyTransaction(agencyId, work));
    }

    /**
     * Runs a query with no agency context. Reserved for platform-staff operations such as
     * creating an agency or cross-agency audits.
     */
    public List<ResultRow> systemQuery(BuiltQuery query) {
        Objects.requireNonNull(query, "query");
        log.info(SYSTEM, "System query:\n{}", query.text());
        return timed(SCOPE_SYSTEM, () -> enforcer.withSystemConnection(connection -> connection.query(query)));
    }

    /** Runs an insert, update or delete with no agency context. */
    public int systemUpdate(BuiltQuery query) {
        Objects.requireNonNull(query, "query");
        log.info(SYSTEM, "System update:\n{}", query.text());
        return timed(SCOPE_SYSTEM, () -> enforcer.withSystemConnection(connection -> connection.update(query)));
    }

    private <T> T timed(String scope, Supplier<T> call) {
        long start = System.nanoTime();
        try {
            T result = call.get();
            metrics.recordQuery(scope, true, System.nanoTime() - start);
            return result;
        } catch (GatewayException e) {
            metrics.recordQuery(scope, false, System.nanoTime() - start);
            metrics.recordError(scope, e.kind());
            if (e.isRetryable()) {
                log.warn("{} call failed ({}): {}", scope, e.kind(), e.getMessage());
            } else {
                log.error("{} call failed ({}): {}", scope, e.kind(), e.getMessage());
            }
            throw e;
        } catch (TenantMismatchException e) {
            metrics.recordQuery(scope, false, System.nanoTime() - start);
            metrics.recordError(scope, "tenant_mismatch");
            log.error("Row from agency {} returned to a call scoped to {}", e.actualAgency(), e.expectedAgency());
            throw e;
        } catch (RuntimeException e) {
            metrics.recordQuery(scope, false, System.nanoTime() - start);
            throw e;
        }
    }
}
