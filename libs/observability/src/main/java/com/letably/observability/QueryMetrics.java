package com.letably.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer instruments for database query execution.
 * <p>
 * Query latency is recorded per scope ({@code scoped} or {@code system}) and outcome, and
 * failures are counted per error kind so pool exhaustion, timeouts and tenant context
 * failures can be told apart on a dashboard. Agency ids are deliberately not used as tags
 * (unbounded cardinality); they are in the logs via MDC instead.
 */
public final class QueryMetrics {

    /** Timer name for query execution. */
    public static final String QUERY_TIMER = "letably.gateway.query";

    /** Counter name for query failures. */
    public static final String ERROR_COUNTER = "letably.gateway.errors";

    /** Tag key for the execution scope. */
    public static final String TAG_SCOPE = "scope";

    /** Tag key for the outcome of a query. */
    public static final String TAG_OUTCOME = "outcome";

    /** Tag key for the error kind. */
    public static final String TAG_KIND = "kind";

    /** Tag key for service name. */
    public static final String TAG_SERVICE = "service";

    private final MeterRegistry registry;
    private final String serviceName;

    /**
     * Creates query metrics bound to the given registry and service name.
     *
     * @param registry    the Micrometer meter registry
     * @param serviceName logical service name included as a tag
     */
    public QueryMetrics(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
    }

    /**
     * Records the duration of one query.
     *
     * @param scope        {@code scoped} or {@code system}
     * @param success      whether the query completed without error
     * @param elapsedNanos elapsed time in nanoseconds
     */
    public void recordQuery(String scope, boolean success, long elapsedNanos) {
        Timer.builder(QUERY_TIMER)
                .description("Query execution time including context set-up")
                .tags(Tags.of(TAG_SERVICE, serviceName, TAG_SCOPE, scope,
                        TAG_OUTCOME, success ? "success" : "failure"))
                .register(registry)
                .record(elapsedNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Counts one failure of the given kind.
     *
     * @param scope {@code scoped} or {@code system}
     * @param kind  error kind (e.g. {@code pool_exhausted}, {@code timeout})
     */
    public void recordError(String scope, String kind) {
        Counter.builder(ERROR_COUNTER)
                .description("Query failures by kind")
                .tags(Tags.of(TAG_SERVICE, serviceName, TAG_SCOPE, scope, TAG_KIND, kind))
                .register(registry)
                .increment();
    }

    /**
     * Returns the underlying meter registry.
     */
    public MeterRegistry registry() {
        return registry;
    }

    /**
     * Returns the service name used as a tag.
     */
    public String serviceName() {
        return serviceName;
    }
}
