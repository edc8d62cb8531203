package com.letably.observability;

import org.slf4j.MDC;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Thread-local holder for {@link RequestContext} with SLF4J MDC bridge.
 * <p>
 * When a context is set, the MDC keys (correlationId, agencyId, userId, requestId) are
 * populated so every log statement on this thread includes them. When cleared, the keys
 * are removed.
 * <p>
 * This holder is for log correlation only. The agency a query runs under is always passed
 * explicitly to the execution gateway and is never read from here.
 */
public final class RequestContextHolder {

    private static final ThreadLocal<RequestContext> CONTEXT = new ThreadLocal<>();

    private RequestContextHolder() {
        // Utility class — no instantiation
    }

    /**
     * Sets the request context for the current thread and populates SLF4J MDC.
     *
     * @param context the context to set (must not be null)
     * @throws IllegalArgumentException if context is null
     */
    public static void set(RequestContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        populateMdc(context);
    }

    /**
     * Returns the current thread's request context, if set.
     */
    public static Optional<RequestContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /**
     * Clears the request context and removes all MDC keys for the current thread.
     */
    public static void clear() {
        CONTEXT.remove();
        clearMdc();
    }

    /**
     * Runs {@code work} with the given context set, then restores the previous context
     * (or clears if there was none).
     *
     * @param context the context for the duration of the work
     * @param work    the work to execute
     * @param <T>     result type
     * @return the work's result
     */
    public static <T> T callWithContext(RequestContext context, Supplier<T> work) {
        RequestContext previous = CONTEXT.get();
        try {
            set(context);
            return work.get();
        } finally {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }

    private static void populateMdc(RequestContext ctx) {
        setMdc(RequestContext.MDC_CORRELATION_ID, ctx.correlationId());
        setMdc(RequestContext.MDC_AGENCY_ID, ctx.agencyId());
        setMdc(RequestContext.MDC_USER_ID, ctx.userId());
        setMdc(RequestContext.MDC_REQUEST_ID, ctx.requestId());
    }

    private static void setMdc(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }

    private static void clearMdc() {
        MDC.remove(RequestContext.MDC_CORRELATION_ID);
        MDC.remove(RequestContext.MDC_AGENCY_ID);
        MDC.remove(RequestContext.MDC_USER_ID);
        MDC.remove(RequestContext.MDC_REQUEST_ID);
    }
}
