package com.letably.security;

/**
 * Compares the agency a call is scoped to with the agency a piece of data belongs to.
 * <p>
 * WHY a utility class: the database enforces row filtering through session configuration, and
 * this check is the second line: any row carrying an agency column is verified on the way out.
 */
public final class TenantIsolationEnforcer {

    private TenantIsolationEnforcer() {
        // utility class
    }

    /**
     * Verifies that a row's agency matches the agency of the current scope.
     *
     * @param scope       agency the call is scoped to
     * @param rowAgencyId agency id stored on the row
     * @throws TenantMismatchException if the agencies differ
     */
    public static void enforce(AgencyId scope, long rowAgencyId) {
        if (scope.value() != rowAgencyId) {
            throw new TenantMismatchException(scope, rowAgencyId);
        }
    }

    /**
     * Verifies that the caller belongs to the given agency.
     *
     * @throws TenantMismatchException if the caller has no agency or a different one
     */
    public static void enforce(CallerContext caller, AgencyId scope) {
        if (caller.agencyId() == null) {
            throw new TenantMismatchException(scope, 0);
        }
        enforce(scope, caller.agencyId().value());
    }
}
