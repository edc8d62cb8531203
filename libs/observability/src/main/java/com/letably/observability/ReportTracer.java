package com.letably.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.function.Supplier;

/**
 * Thin wrapper around an OpenTelemetry {@link Tracer} that wraps report generation in a span
 * and attaches request context attributes.
 * <p>
 * The SDK (exporter, sampler) is configured by the hosting application; this class only uses
 * the API.
 */
public final class ReportTracer {

    /** Span attribute holding the report type. */
    public static final String ATTR_REPORT_TYPE = "report.type";

    /** Span attribute holding the agency id. */
    public static final String ATTR_AGENCY_ID = "agency.id";

    private final Tracer tracer;

    /**
     * Creates a ReportTracer backed by the given OTel tracer.
     *
     * @param tracer the OpenTelemetry tracer
     */
    public ReportTracer(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /**
     * Runs {@code work} inside a span named {@code report.<type>}. The span is ended on every
     * path; exceptions are recorded and rethrown unchanged.
     *
     * @param reportType report type key (e.g. "portfolio")
     * @param agencyId   agency the report is generated for
     * @param work       the generation work
     * @param <T>        result type
     * @return the work's result
     */
    public <T> T trace(String reportType, long agencyId, Supplier<T> work) {
        Span span = tracer.spanBuilder("report." + reportType)
                .setSpanKind(SpanKind.INTERNAL)
                .setAttribute(ATTR_REPORT_TYPE, reportType)
                .setAttribute(ATTR_AGENCY_ID, agencyId)
                .startSpan();

        RequestContextHolder.get().ifPresent(ctx -> {
            span.setAttribute("correlation.id", ctx.correlationId());
            if (ctx.userId() != null) {
                span.setAttribute("user.id", ctx.userId());
            }
        });

        try (Scope ignored = span.makeCurrent()) {
            T result = work.get();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getClass().getSimpleName());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Returns the underlying OTel tracer.
     */
    public Tracer tracer() {
        return tracer;
    }
}
