package com.letably.observability;

/**
 * Immutable context describing the request a unit of work belongs to.
 * <p>
 * Every report request establishes a {@code RequestContext} so that all log statements
 * emitted while the request's queries run can be correlated and attributed to an agency.
 * Values are injected into SLF4J MDC by {@link RequestContextHolder}.
 *
 * @param correlationId unique ID for the business flow (required)
 * @param agencyId      agency (tenant) the request is scoped to (nullable for system work)
 * @param userId        authenticated user performing the action (nullable for system work)
 * @param requestId     unique ID for this specific request (nullable)
 */
public record RequestContext(
        String correlationId,
        String agencyId,
        String userId,
        String requestId
) {

    /**
     * MDC key for correlation ID.
     */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /**
     * MDC key for agency ID.
     */
    public static final String MDC_AGENCY_ID = "agencyId";

    /**
     * MDC key for user ID.
     */
    public static final String MDC_USER_ID = "userId";

    /**
     * MDC key for request ID.
     */
    public static final String MDC_REQUEST_ID = "requestId";

    /**
     * Compact constructor — ensures correlationId is never null.
     */
    public RequestContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Returns a copy of this context bound to another agency.
     */
    public RequestContext withAgency(String newAgencyId) {
        return new RequestContext(correlationId, newAgencyId, userId, requestId);
    }
}
