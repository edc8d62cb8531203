package com.letably.security;

/**
 * Thrown when a row belonging to one agency is observed inside another agency's scoped call.
 * <p>
 * WHY a RuntimeException: a cross-agency row is a security defect, not a recoverable
 * condition. Fail fast and loud.
 */
public class TenantMismatchException extends RuntimeException {

    private final AgencyId expectedAgency;
    private final long actualAgency;

    public TenantMismatchException(AgencyId expectedAgency, long actualAgency) {
        super("Agency mismatch: call scoped to agency %d observed a row of agency %d"
                .formatted(expectedAgency.value(), actualAgency));
        this.expectedAgency = expectedAgency;
        this.actualAgency = actualAgency;
    }

    public AgencyId expectedAgency() {
        return expectedAgency;
    }

    public long actualAgency() {
        return actualAgency;
    }
}
